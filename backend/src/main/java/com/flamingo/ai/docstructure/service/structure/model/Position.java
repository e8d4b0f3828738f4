package com.flamingo.ai.docstructure.service.structure.model;

/**
 * One geometry fragment of a block or table.
 *
 * @param page 1-based page number relative to the first requested page
 * @param left left edge in page coordinate units
 * @param right right edge
 * @param top top edge (distance from the top of the page)
 * @param bottom bottom edge
 */
public record Position(int page, double left, double right, double top, double bottom) {

  /** Sentinel for content that carries no geometry (vision output, plain text lines). */
  public static final Position NONE = new Position(0, 0, 0, 0, 0);

  /** Returns {@code true} when all five fields are zero. */
  public boolean isEmpty() {
    return page == 0 && left == 0 && right == 0 && top == 0 && bottom == 0;
  }
}
