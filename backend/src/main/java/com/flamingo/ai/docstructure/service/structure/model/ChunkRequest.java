package com.flamingo.ai.docstructure.service.structure.model;

/**
 * Everything needed to chunk one document.
 *
 * @param source document name and bytes
 * @param fromPage first page to process (0-based, inclusive)
 * @param toPage page to stop at (exclusive)
 * @param language language hint, passed through
 * @param parserConfig parser options
 */
public record ChunkRequest(
    DocumentSource source, int fromPage, int toPage, String language, ParserConfig parserConfig) {

  /** {@code true} when the language hint asks for English tokenization. */
  public boolean english() {
    return "english".equalsIgnoreCase(language);
  }
}
