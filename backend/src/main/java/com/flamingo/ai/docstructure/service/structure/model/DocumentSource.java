package com.flamingo.ai.docstructure.service.structure.model;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A document identified by name, with its bytes.
 *
 * @param name file name; its extension selects the chunking strategy
 * @param content raw document bytes
 */
public record DocumentSource(String name, byte[] content) {

  public static DocumentSource of(String name, byte[] content) {
    return new DocumentSource(name, content);
  }

  /**
   * Reads the document from disk, naming it after the file.
   *
   * @throws DocumentProcessingException if the file cannot be read
   */
  public static DocumentSource fromPath(Path path) {
    String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
    try {
      return new DocumentSource(name, Files.readAllBytes(path));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          name, "Failed to read document: " + e.getMessage(), e);
    }
  }
}
