package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * A positioned unit of text produced by a layout engine.
 *
 * @param text cleaned block text
 * @param layoutLabel layout class assigned by the engine (e.g. {@code title}, {@code text}); may
 *     be empty
 * @param positions one fragment per line or page span; never empty
 */
public record Block(String text, String layoutLabel, List<Position> positions) {

  public Block {
    positions = positions == null || positions.isEmpty() ? List.of(Position.NONE) : positions;
    layoutLabel = layoutLabel == null ? "" : layoutLabel;
  }

  /** Creates a block without geometry. */
  public static Block withoutPosition(String text, String layoutLabel) {
    return new Block(text, layoutLabel, List.of(Position.NONE));
  }
}
