package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * A normalized table.
 *
 * @param markup self-contained HTML table
 * @param positions geometry carried alongside the markup
 */
public record ExtractedTable(String markup, List<Position> positions) {}
