package com.flamingo.ai.docstructure.service.structure.heading;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Takes heading levels from the document outline.
 *
 * <p>Each block is compared against every outline entry by character-bigram overlap; the first
 * entry whose overlap ratio exceeds the configured threshold gives the block its level. Blocks
 * without a matching entry are body text at {@code maxOutlineLevel + 1}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutlineMatchingStrategy implements HeadingLevelStrategy {

  private final StructureConfig structureConfig;

  @Override
  public HeadingLevels classify(List<Block> blocks, List<OutlineEntry> outline) {
    int maxLevel = outline.stream().mapToInt(OutlineEntry::level).max().orElse(0);
    int pivot = Math.max(0, maxLevel - 1);
    double threshold = structureConfig.getOutline().getSimilarityThreshold();

    List<Set<String>> outlineBigrams = new ArrayList<>(outline.size());
    for (OutlineEntry entry : outline) {
      int[] codePoints = entry.text().codePoints().toArray();
      outlineBigrams.add(bigrams(codePoints, codePoints.length - 1));
    }

    List<Integer> levels = new ArrayList<>(blocks.size());
    int matched = 0;
    for (Block block : blocks) {
      int[] blockCodePoints = block.text().codePoints().toArray();
      int level = maxLevel + 1;
      for (int i = 0; i < outline.size(); i++) {
        int outlineLength = outline.get(i).text().codePointCount(0, outline.get(i).text().length());
        int limit = Math.min(outlineLength, blockCodePoints.length - 1);
        Set<String> blockBigrams = bigrams(blockCodePoints, limit);
        if (similarity(outlineBigrams.get(i), blockBigrams) > threshold) {
          level = outline.get(i).level();
          matched++;
          break;
        }
      }
      levels.add(level);
    }

    log.debug(
        "Outline matched {}/{} blocks (max outline level {}, pivot {})",
        matched,
        blocks.size(),
        maxLevel,
        pivot);
    return new HeadingLevels(levels, pivot);
  }

  @Override
  public String getStrategyName() {
    return "outline";
  }

  /** Bigrams starting at indexes {@code 0 .. limit-1}. */
  static Set<String> bigrams(int[] codePoints, int limit) {
    Set<String> result = new HashSet<>();
    for (int i = 0; i < limit && i + 1 < codePoints.length; i++) {
      result.add(new String(codePoints, i, 2));
    }
    return result;
  }

  static double similarity(Set<String> outline, Set<String> block) {
    Set<String> common = new HashSet<>(outline);
    common.retainAll(block);
    return (double) common.size() / Math.max(Math.max(outline.size(), block.size()), 1);
  }
}
