package com.flamingo.ai.docstructure.service.structure.model;

/**
 * Per-request parser options.
 *
 * @param chunkTokenNum advisory chunk size, passed through to the indexer
 * @param delimiter sentence-boundary characters, passed through to the tokenizer
 * @param layoutRecognize {@code DeepDOC}, {@code Plain Text}, or the name of a vision model
 */
public record ParserConfig(int chunkTokenNum, String delimiter, String layoutRecognize) {}
