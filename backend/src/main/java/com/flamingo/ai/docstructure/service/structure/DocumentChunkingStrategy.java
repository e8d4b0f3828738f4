package com.flamingo.ai.docstructure.service.structure;

import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;

/**
 * One full extraction-and-chunking pipeline for a family of document formats.
 *
 * <p>{@link DocumentChunkingService} depends only on this interface through {@link
 * DocumentChunkingStrategyRouter}; a new format is supported by registering another
 * implementation as a Spring bean.
 */
public interface DocumentChunkingStrategy {

  /**
   * Returns {@code true} if this strategy handles the given file name (by extension).
   *
   * @param fileName document file name
   * @return {@code true} if supported
   */
  boolean supports(String fileName);

  /**
   * Extracts, structures and chunks the document.
   *
   * @param request document and options
   * @param listener progress callback
   * @return records in output order
   */
  ChunkingResult chunk(ChunkRequest request, ProgressListener listener);
}
