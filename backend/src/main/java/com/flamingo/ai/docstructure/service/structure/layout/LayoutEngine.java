package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.service.structure.model.LayoutResult;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;

/**
 * Turns the pages of a PDF into positioned text blocks, an optional outline and tables.
 *
 * <p>Implementations are selected per request through the {@code layout_recognize} option.
 */
public interface LayoutEngine {

  /**
   * Analyzes pages {@code [fromPage, toPage)} of a PDF.
   *
   * @param pdf raw PDF bytes
   * @param fromPage first page (0-based, inclusive)
   * @param toPage page to stop before; clamped to the page count
   * @param listener progress callback
   * @return blocks, outline and tables of the requested pages
   * @throws com.flamingo.ai.docstructure.exception.DocumentProcessingException if the PDF cannot
   *     be read
   */
  LayoutResult analyze(byte[] pdf, int fromPage, int toPage, ProgressListener listener);

  /** Value of {@code layout_recognize} this engine answers to. */
  String getEngineName();
}
