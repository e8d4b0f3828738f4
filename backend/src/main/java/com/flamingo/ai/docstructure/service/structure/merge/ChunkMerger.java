package com.flamingo.ai.docstructure.service.structure.merge;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.geometry.GeometryTagger;
import com.flamingo.ai.docstructure.service.structure.model.SectionedItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Greedy, order-preserving merge of blocks and tables into token-bounded chunks.
 *
 * <p>Items are sorted into reading order (page, top, left of their first fragment) and appended
 * to the open chunk while it is still tiny, or while it is below the upper bound and the item
 * belongs to the same section or is a table. Every item contributes its geometry tags to the
 * chunk text.
 *
 * <p>When every item is in section 0 the document carries no structure at all (e.g. one block
 * per page from a vision model); each item then becomes its own chunk.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkMerger {

  static final Comparator<SectionedItem> READING_ORDER =
      Comparator.<SectionedItem>comparingInt(item -> item.firstPosition().page())
          .thenComparingDouble(item -> item.firstPosition().top())
          .thenComparingDouble(item -> item.firstPosition().left());

  private final TokenCounter tokenCounter;
  private final StructureConfig structureConfig;

  /**
   * Merges items into chunk texts.
   *
   * @param items blocks with section ids and tables with {@link SectionedItem#TABLE_SECTION}
   * @return finalized chunk texts with inline geometry tags, in reading order
   */
  public List<String> merge(List<SectionedItem> items) {
    List<SectionedItem> sorted = new ArrayList<>(items);
    sorted.sort(READING_ORDER);

    boolean unstructured = !sorted.isEmpty() && sorted.stream().allMatch(i -> i.sectionId() == 0);
    ChunkAccumulator accumulator =
        new ChunkAccumulator(
            structureConfig.getMerge().getMinTokens(), structureConfig.getMerge().getMaxTokens());

    for (SectionedItem item : sorted) {
      String text = item.text() + GeometryTagger.tags(item.positions());
      int tokens = tokenCounter.count(item.text());
      if (!unstructured && accumulator.accepts(item.sectionId())) {
        accumulator.append(text, tokens);
      } else {
        accumulator.startNew(text, tokens);
      }
      accumulator.track(item.sectionId());
    }

    List<String> chunks = accumulator.chunks();
    log.debug(
        "Merged {} items into {} chunks{}",
        sorted.size(),
        chunks.size(),
        unstructured ? " (one chunk per item)" : "");
    return chunks;
  }

  /** Per-call merge state: finished chunk texts, the open chunk's token count, last section. */
  static final class ChunkAccumulator {

    private static final int NO_SECTION = -2;

    private final int minTokens;
    private final int maxTokens;
    private final List<StringBuilder> chunks = new ArrayList<>();
    private int tokenCount;
    private int lastSectionId = NO_SECTION;

    ChunkAccumulator(int minTokens, int maxTokens) {
      this.minTokens = minTokens;
      this.maxTokens = maxTokens;
    }

    boolean accepts(int sectionId) {
      if (chunks.isEmpty()) {
        return false;
      }
      return tokenCount < minTokens
          || (tokenCount < maxTokens
              && (sectionId == lastSectionId || sectionId == SectionedItem.TABLE_SECTION));
    }

    void append(String text, int tokens) {
      chunks.get(chunks.size() - 1).append('\n').append(text);
      tokenCount += tokens;
    }

    void startNew(String text, int tokens) {
      chunks.add(new StringBuilder(text));
      tokenCount = tokens;
    }

    /** Tables never redefine the current section. */
    void track(int sectionId) {
      if (sectionId != SectionedItem.TABLE_SECTION) {
        lastSectionId = sectionId;
      }
    }

    List<String> chunks() {
      return chunks.stream().map(StringBuilder::toString).toList();
    }
  }
}
