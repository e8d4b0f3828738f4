package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * One indexable unit produced for a document.
 *
 * @param documentName source file name
 * @param title file name without extension
 * @param type record kind
 * @param content chunk text with inline geometry tags, table markup, or Q/A text
 * @param positions structured geometry (tables only; text chunks carry it inline)
 * @param image PNG bytes of the answer image for {@link RecordType#IMAGE}, otherwise null
 * @param language language hint passed through for downstream tokenization
 */
public record IndexRecord(
    String documentName,
    String title,
    RecordType type,
    String content,
    List<Position> positions,
    byte[] image,
    String language) {}
