package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.service.structure.heading.HeadingLevelClassifier;
import com.flamingo.ai.docstructure.service.structure.layout.LayoutEngine;
import com.flamingo.ai.docstructure.service.structure.layout.LayoutEngineSelector;
import com.flamingo.ai.docstructure.service.structure.merge.ChunkMerger;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.ExtractedTable;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.IndexRecord;
import com.flamingo.ai.docstructure.service.structure.model.LayoutResult;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import com.flamingo.ai.docstructure.service.structure.model.SectionedItem;
import com.flamingo.ai.docstructure.service.structure.section.SectionAssigner;
import com.flamingo.ai.docstructure.service.structure.table.TableNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Chunks PDF manuals: layout analysis, heading inference, sectioning and token-bounded merging.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>The layout engine named by {@code layout_recognize} extracts blocks, outline and tables.
 *       A vision engine that fails for any reason (model call, page rendering) is replaced by the
 *       deterministic PDFBox engine.
 *   <li>{@link HeadingLevelClassifier} infers a level per block; {@link SectionAssigner} turns
 *       levels into section ids.
 *   <li>Tables are normalized to HTML and join the blocks with the table wildcard section.
 *   <li>{@link ChunkMerger} builds the chunks.
 * </ol>
 *
 * <p>Tables are emitted as records of their own first, followed by one record per chunk.
 */
@Service
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class ManualPdfChunkingStrategy implements DocumentChunkingStrategy {

  private final LayoutEngineSelector layoutEngineSelector;
  private final HeadingLevelClassifier headingLevelClassifier;
  private final SectionAssigner sectionAssigner;
  private final TableNormalizer tableNormalizer;
  private final ChunkMerger chunkMerger;

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  @Override
  public ChunkingResult chunk(ChunkRequest request, ProgressListener listener) {
    LayoutResult layout = analyzeLayout(request, listener);
    List<Block> blocks = layout.blocks();

    HeadingLevels levels = headingLevelClassifier.classify(blocks, layout.outline());
    List<Integer> sectionIds = sectionAssigner.assign(levels);
    List<ExtractedTable> tables = tableNormalizer.normalizeAll(layout.tables());

    List<SectionedItem> items = new ArrayList<>(blocks.size() + tables.size());
    for (int i = 0; i < blocks.size(); i++) {
      Block block = blocks.get(i);
      items.add(new SectionedItem(block.text(), sectionIds.get(i), block.positions()));
    }
    for (ExtractedTable table : tables) {
      items.add(new SectionedItem(table.markup(), SectionedItem.TABLE_SECTION, table.positions()));
    }
    List<String> chunks = chunkMerger.merge(items);

    IndexRecordFactory records = new IndexRecordFactory(request);
    List<IndexRecord> result = new ArrayList<>(tables.size() + chunks.size());
    tables.forEach(table -> result.add(records.table(table)));
    chunks.forEach(chunk -> result.add(records.text(chunk)));

    log.debug(
        "PDF {}: {} blocks, {} tables, pivot level {}, {} chunks",
        request.source().name(),
        blocks.size(),
        tables.size(),
        levels.pivotLevel(),
        chunks.size());
    return new ChunkingResult(request.source().name(), request.parserConfig(), result);
  }

  private LayoutResult analyzeLayout(ChunkRequest request, ProgressListener listener) {
    String engineName = request.parserConfig().layoutRecognize();
    byte[] pdf = request.source().content();
    if (!LayoutEngineSelector.isVisionModel(engineName)) {
      return layoutEngineSelector
          .select(engineName)
          .analyze(pdf, request.fromPage(), request.toPage(), listener);
    }

    try {
      LayoutEngine engine = layoutEngineSelector.select(engineName);
      LayoutResult result = engine.analyze(pdf, request.fromPage(), request.toPage(), listener);
      listener.onProgress(0.8, "Vision model parsing completed.");
      return result;
    } catch (RuntimeException e) {
      log.warn(
          "Failed to use vision model {}: {}. Falling back to {}.",
          engineName,
          e.getMessage(),
          layoutEngineSelector.fallback().getEngineName());
      return layoutEngineSelector
          .fallback()
          .analyze(pdf, request.fromPage(), request.toPage(), listener);
    }
  }
}
