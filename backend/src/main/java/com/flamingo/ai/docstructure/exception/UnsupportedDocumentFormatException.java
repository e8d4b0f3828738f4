package com.flamingo.ai.docstructure.exception;

/** Exception thrown when no chunking strategy recognizes the document's file extension. */
public class UnsupportedDocumentFormatException extends RuntimeException {

  private final String documentName;

  public UnsupportedDocumentFormatException(String documentName) {
    super("File type not supported yet (pdf, docx and doc supported): " + documentName);
    this.documentName = documentName;
  }

  public String getDocumentName() {
    return documentName;
  }
}
