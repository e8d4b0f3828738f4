package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * Records produced for one document.
 *
 * @param documentName source file name
 * @param parserConfig options the document was processed with
 * @param records tables first, then text/Q&A records, in output order
 */
public record ChunkingResult(
    String documentName, ParserConfig parserConfig, List<IndexRecord> records) {}
