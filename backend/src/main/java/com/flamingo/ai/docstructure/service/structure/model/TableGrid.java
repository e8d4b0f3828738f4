package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * A table as read from the source, before normalization.
 *
 * @param rows cell texts, row by row; horizontally merged cells are repeated
 * @param positions geometry of the table; a single {@link Position#NONE} when unknown
 */
public record TableGrid(List<List<String>> rows, List<Position> positions) {

  public TableGrid {
    positions = positions == null || positions.isEmpty() ? List.of(Position.NONE) : positions;
  }
}
