package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for chunking one document: routes it to its strategy, records metrics and logs the
 * outcome. Failures are counted and rethrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentChunkingService {

  private final DocumentChunkingStrategyRouter strategyRouter;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks a document.
   *
   * @param request document and options
   * @param listener progress callback
   * @return records in output order
   * @throws com.flamingo.ai.docstructure.exception.UnsupportedDocumentFormatException if the file
   *     type is not supported; raised before any extraction work
   */
  @Timed(value = "document.chunking", description = "Time to chunk a document")
  public ChunkingResult chunk(ChunkRequest request, ProgressListener listener) {
    String name = request.source().name();
    DocumentChunkingStrategy strategy = strategyRouter.route(name);
    try {
      log.info(
          "Chunking {} with {} (pages {}-{}, layout {})",
          name,
          strategy.getClass().getSimpleName(),
          request.fromPage(),
          request.toPage(),
          request.parserConfig().layoutRecognize());
      ChunkingResult result = strategy.chunk(request, listener);
      meterRegistry.counter("document.chunking.success").increment();
      meterRegistry.counter("document.chunking.records").increment(result.records().size());
      log.info("Chunked {} into {} records", name, result.records().size());
      return result;
    } catch (RuntimeException e) {
      log.error("Failed to chunk document {}: {}", name, e.getMessage());
      meterRegistry.counter("document.chunking.failure").increment();
      throw e;
    }
  }

  public ChunkingResult chunk(ChunkRequest request) {
    return chunk(request, ProgressListener.NO_OP);
  }
}
