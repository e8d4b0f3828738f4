package com.flamingo.ai.docstructure.service.structure.hierarchy;

import com.flamingo.ai.docstructure.service.structure.model.HierarchicalContent;

/** Reads a word-processing document into a paragraph stream and its tables. */
public interface HierarchicalDocumentReader {

  /**
   * Returns {@code true} if this reader handles the given file name (by extension).
   *
   * @param fileName document file name
   */
  boolean supports(String fileName);

  /**
   * Reads the document.
   *
   * @param documentName name used in error messages
   * @param content raw document bytes
   * @return paragraphs in document order and top-level tables
   * @throws com.flamingo.ai.docstructure.exception.DocumentProcessingException if the document
   *     cannot be read
   */
  HierarchicalContent read(String documentName, byte[] content);
}
