package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.exception.UnsupportedDocumentFormatException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a document file name to the first {@link DocumentChunkingStrategy} that supports it.
 *
 * <p>Strategies are injected by Spring in {@code @Order} order (ascending).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentChunkingStrategyRouter {

  private final List<DocumentChunkingStrategy> strategies;

  /**
   * Returns the strategy for the given file name.
   *
   * @param fileName document file name (e.g. {@code manual.pdf})
   * @return selected strategy
   * @throws UnsupportedDocumentFormatException if no strategy supports the extension
   */
  public DocumentChunkingStrategy route(String fileName) {
    return strategies.stream()
        .filter(s -> s.supports(fileName))
        .findFirst()
        .orElseThrow(
            () -> {
              log.warn("No chunking strategy for {}", fileName);
              return new UnsupportedDocumentFormatException(fileName);
            });
  }
}
