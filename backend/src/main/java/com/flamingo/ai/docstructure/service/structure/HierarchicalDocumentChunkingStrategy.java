package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.LlmServiceException;
import com.flamingo.ai.docstructure.service.structure.hierarchy.HierarchicalDocumentReader;
import com.flamingo.ai.docstructure.service.structure.layout.LayoutEngineSelector;
import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.ExtractedTable;
import com.flamingo.ai.docstructure.service.structure.model.HierarchicalContent;
import com.flamingo.ai.docstructure.service.structure.model.IndexRecord;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import com.flamingo.ai.docstructure.service.structure.model.QaUnit;
import com.flamingo.ai.docstructure.service.structure.qa.ImageDescriber;
import com.flamingo.ai.docstructure.service.structure.qa.QaReconstructor;
import com.flamingo.ai.docstructure.service.structure.table.TableNormalizer;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelClient;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelFactory;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Chunks Word documents into question/answer units.
 *
 * <p>Headings form the question path and the body beneath them the answer; see {@link
 * QaReconstructor}. When {@code layout_recognize} names a vision model, embedded pictures are
 * transcribed by that model; otherwise they are kept as images on the record.
 */
@Service
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class HierarchicalDocumentChunkingStrategy implements DocumentChunkingStrategy {

  private final List<HierarchicalDocumentReader> readers;
  private final QaReconstructor qaReconstructor;
  private final TableNormalizer tableNormalizer;
  private final VisionModelFactory visionModelFactory;
  private final StructureConfig structureConfig;

  @Override
  public boolean supports(String fileName) {
    return readers.stream().anyMatch(reader -> reader.supports(fileName));
  }

  @Override
  public ChunkingResult chunk(ChunkRequest request, ProgressListener listener) {
    String name = request.source().name();
    HierarchicalDocumentReader reader =
        readers.stream()
            .filter(r -> r.supports(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No reader for " + name));

    ImageDescriber describer = imageDescriber(request.parserConfig().layoutRecognize(), listener);
    HierarchicalContent content = reader.read(name, request.source().content());
    List<QaUnit> units =
        qaReconstructor.reconstruct(
            content.paragraphs(), request.fromPage(), request.toPage(), describer);
    List<ExtractedTable> tables = tableNormalizer.normalizeAll(content.tables());

    IndexRecordFactory records = new IndexRecordFactory(request);
    List<IndexRecord> result = new ArrayList<>(tables.size() + units.size());
    tables.forEach(table -> result.add(records.table(table)));
    units.forEach(unit -> result.add(records.qa(unit)));

    log.debug(
        "Word document {}: {} paragraphs, {} Q/A units, {} tables",
        name,
        content.paragraphs().size(),
        units.size(),
        tables.size());
    return new ChunkingResult(name, request.parserConfig(), result);
  }

  /** Returns a describer backed by the named vision model, or {@code null} when none is usable. */
  private ImageDescriber imageDescriber(String layoutRecognize, ProgressListener listener) {
    if (!LayoutEngineSelector.isVisionModel(layoutRecognize)) {
      return null;
    }
    try {
      VisionModelClient client = visionModelFactory.create(layoutRecognize);
      String prompt = structureConfig.getVision().getPrompt();
      listener.onProgress(0.05, "Using " + layoutRecognize + " for image processing in DOCX.");
      return image -> client.describe(image, prompt);
    } catch (LlmServiceException e) {
      log.info("Vision model {} not available for DOCX: {}", layoutRecognize, e.getMessage());
      return null;
    }
  }
}
