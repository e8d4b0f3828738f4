package com.flamingo.ai.docstructure.service.structure.model;

/**
 * A heading reported by the document outline (PDF bookmarks).
 *
 * @param text heading text
 * @param level nesting depth, 0 for top-level entries
 */
public record OutlineEntry(String text, int level) {}
