package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.service.structure.model.Position;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.pdfbox.text.TextPosition;

/**
 * Finds tables drawn with ruling lines.
 *
 * <p>Horizontal and vertical rulings that cross each other form one table. The distinct ruling
 * positions give the row and column boundaries; a column boundary without a vertical ruling inside
 * a row marks horizontally merged cells, whose text is repeated across the merged columns. Glyphs
 * are placed in the cell containing their center.
 */
final class RulingTableDetector {

  /** Positions closer than this (pt) are the same boundary. */
  static final float TOLERANCE = 2.0f;

  /** Shorter axis-aligned segments are ignored (tick marks, underlines of single glyphs). */
  static final float MIN_RULING_LENGTH = 10.0f;

  private static final float SAME_LINE_TOLERANCE = 2.0f;
  private static final float WORD_GAP_FACTOR = 0.25f;

  private RulingTableDetector() {}

  /**
   * An axis-aligned line in top-down page space.
   *
   * @param horizontal {@code true} for horizontal lines
   * @param position y of a horizontal line, x of a vertical one
   * @param start smaller coordinate along the line
   * @param end larger coordinate along the line
   */
  record Ruling(boolean horizontal, float position, float start, float end) {

    boolean crosses(Ruling other) {
      return within(other.position, start, end) && within(position, other.start, other.end);
    }

    boolean covers(float at) {
      return within(at, start, end);
    }

    private static boolean within(float value, float from, float to) {
      return value >= from - TOLERANCE && value <= to + TOLERANCE;
    }
  }

  /** One glyph in top-down page space, as reported by the text stripper. */
  record Glyph(String text, float x, float y, float width, float height, float fontSize) {

    static Glyph of(TextPosition position) {
      return new Glyph(
          position.getUnicode() == null ? "" : position.getUnicode(),
          position.getXDirAdj(),
          position.getYDirAdj(),
          position.getWidthDirAdj(),
          position.getHeightDir(),
          position.getFontSizeInPt());
    }

    float centerX() {
      return x + width / 2;
    }

    float centerY() {
      return y - height / 2;
    }
  }

  /**
   * A detected table.
   *
   * @param page page number relative to the first requested page
   * @param rows cell texts row by row, merged cells repeated
   */
  record DetectedTable(
      int page, List<List<String>> rows, float left, float right, float top, float bottom) {

    /** Whether a line's box lies within this table. */
    boolean contains(Position position) {
      double x = (position.left() + position.right()) / 2;
      double y = (position.top() + position.bottom()) / 2;
      return position.page() == page
          && x >= left - TOLERANCE
          && x <= right + TOLERANCE
          && y >= top - TOLERANCE
          && y <= bottom + TOLERANCE;
    }

    TableGrid toGrid() {
      return new TableGrid(rows, List.of(new Position(page, left, right, top, bottom)));
    }
  }

  /** Converts a segment to a ruling when it is long enough and axis aligned. */
  static Optional<Ruling> toRuling(float x1, float y1, float x2, float y2) {
    if (Math.abs(y1 - y2) <= TOLERANCE && Math.abs(x1 - x2) >= MIN_RULING_LENGTH) {
      return Optional.of(new Ruling(true, (y1 + y2) / 2, Math.min(x1, x2), Math.max(x1, x2)));
    }
    if (Math.abs(x1 - x2) <= TOLERANCE && Math.abs(y1 - y2) >= MIN_RULING_LENGTH) {
      return Optional.of(new Ruling(false, (x1 + x2) / 2, Math.min(y1, y2), Math.max(y1, y2)));
    }
    return Optional.empty();
  }

  /**
   * Detects the tables of one page.
   *
   * @param page page number relative to the first requested page
   * @param rulings rulings drawn on the page
   * @param glyphs glyphs of the page in reading order
   * @return tables with at least two cells and some text, top to bottom
   */
  static List<DetectedTable> detect(int page, List<Ruling> rulings, List<Glyph> glyphs) {
    List<DetectedTable> tables = new ArrayList<>();
    for (List<Ruling> group : crossingGroups(rulings)) {
      toTable(page, group, glyphs).ifPresent(tables::add);
    }
    tables.sort((a, b) -> Float.compare(a.top(), b.top()));
    return tables;
  }

  // ---- private helpers ----

  /** Splits rulings into groups connected by crossings (union-find). */
  private static List<List<Ruling>> crossingGroups(List<Ruling> rulings) {
    int[] parent = new int[rulings.size()];
    for (int i = 0; i < parent.length; i++) {
      parent[i] = i;
    }
    for (int i = 0; i < rulings.size(); i++) {
      for (int j = i + 1; j < rulings.size(); j++) {
        Ruling a = rulings.get(i);
        Ruling b = rulings.get(j);
        if (a.horizontal() != b.horizontal() && a.crosses(b)) {
          parent[root(parent, i)] = root(parent, j);
        }
      }
    }

    List<List<Ruling>> groups = new ArrayList<>();
    List<Integer> roots = new ArrayList<>();
    for (int i = 0; i < rulings.size(); i++) {
      int r = root(parent, i);
      int index = roots.indexOf(r);
      if (index < 0) {
        roots.add(r);
        groups.add(new ArrayList<>());
        index = groups.size() - 1;
      }
      groups.get(index).add(rulings.get(i));
    }
    return groups;
  }

  private static int root(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }

  private static Optional<DetectedTable> toTable(int page, List<Ruling> group, List<Glyph> glyphs) {
    List<Ruling> verticals = group.stream().filter(r -> !r.horizontal()).toList();
    float[] ys = boundaries(group.stream().filter(Ruling::horizontal).toList());
    float[] xs = boundaries(verticals);
    int rowCount = ys.length - 1;
    int columnCount = xs.length - 1;
    if (rowCount < 1 || columnCount < 1 || rowCount * columnCount < 2) {
      return Optional.empty();
    }

    List<List<List<Glyph>>> cells = new ArrayList<>();
    for (int r = 0; r < rowCount; r++) {
      List<List<Glyph>> row = new ArrayList<>();
      for (int c = 0; c < columnCount; c++) {
        row.add(new ArrayList<>());
      }
      cells.add(row);
    }
    for (Glyph glyph : glyphs) {
      int r = slot(ys, glyph.centerY());
      int c = slot(xs, glyph.centerX());
      if (r >= 0 && c >= 0) {
        cells.get(r).get(c).add(glyph);
      }
    }

    boolean hasText = false;
    List<List<String>> rows = new ArrayList<>();
    for (int r = 0; r < rowCount; r++) {
      float middle = (ys[r] + ys[r + 1]) / 2;
      List<String> row = new ArrayList<>(columnCount);
      int c = 0;
      while (c < columnCount) {
        int end = c + 1;
        while (end < columnCount && !separated(verticals, xs[end], middle)) {
          end++;
        }
        StringBuilder merged = new StringBuilder();
        for (int k = c; k < end; k++) {
          String text = cellText(cells.get(r).get(k));
          if (!text.isEmpty()) {
            merged.append(merged.length() > 0 ? " " : "").append(text);
          }
        }
        hasText |= merged.length() > 0;
        row.addAll(Collections.nCopies(end - c, merged.toString()));
        c = end;
      }
      rows.add(row);
    }
    if (!hasText) {
      return Optional.empty();
    }
    return Optional.of(new DetectedTable(page, rows, xs[0], xs[columnCount], ys[0], ys[rowCount]));
  }

  /** Sorted distinct ruling positions, nearby positions averaged. */
  private static float[] boundaries(List<Ruling> rulings) {
    float[] positions = new float[rulings.size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = rulings.get(i).position();
    }
    Arrays.sort(positions);

    List<Float> merged = new ArrayList<>();
    int i = 0;
    while (i < positions.length) {
      float sum = positions[i];
      int count = 1;
      while (i + count < positions.length && positions[i + count] - positions[i] <= TOLERANCE) {
        sum += positions[i + count];
        count++;
      }
      merged.add(sum / count);
      i += count;
    }

    float[] result = new float[merged.size()];
    for (int k = 0; k < result.length; k++) {
      result[k] = merged.get(k);
    }
    return result;
  }

  /** Index of the interval containing {@code value}, or -1 outside all intervals. */
  private static int slot(float[] bounds, float value) {
    for (int i = 0; i < bounds.length - 1; i++) {
      if (value >= bounds[i] && value < bounds[i + 1]) {
        return i;
      }
    }
    return -1;
  }

  private static boolean separated(List<Ruling> verticals, float x, float y) {
    return verticals.stream()
        .anyMatch(v -> Math.abs(v.position() - x) <= TOLERANCE && v.covers(y));
  }

  /** Concatenates the glyphs of one cell, separating words and wrapped lines by a space. */
  static String cellText(List<Glyph> glyphs) {
    StringBuilder text = new StringBuilder();
    Glyph previous = null;
    for (Glyph glyph : glyphs) {
      if (previous != null && text.length() > 0 && !glyph.text().isBlank()) {
        boolean newLine = Math.abs(glyph.y() - previous.y()) > SAME_LINE_TOLERANCE;
        float gap = glyph.x() - (previous.x() + previous.width());
        char last = text.charAt(text.length() - 1);
        if (!Character.isWhitespace(last)
            && (newLine || gap > glyph.fontSize() * WORD_GAP_FACTOR)) {
          text.append(' ');
        }
      }
      text.append(glyph.text());
      previous = glyph;
    }
    return PdfText.clean(text.toString());
  }
}
