package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * A block or table ready for merging.
 *
 * @param text block text or table markup
 * @param sectionId section the item belongs to; {@link #TABLE_SECTION} for tables
 * @param positions geometry fragments; the first one drives reading order
 */
public record SectionedItem(String text, int sectionId, List<Position> positions) {

  public static final int TABLE_SECTION = -1;

  public SectionedItem {
    positions = positions == null || positions.isEmpty() ? List.of(Position.NONE) : positions;
  }

  public Position firstPosition() {
    return positions.get(0);
  }
}
