package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * Paragraph stream and tables read from a hierarchical source.
 *
 * @param paragraphs body paragraphs in document order
 * @param tables top-level tables in document order
 */
public record HierarchicalContent(List<DocParagraph> paragraphs, List<TableGrid> tables) {}
