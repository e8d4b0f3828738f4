package com.flamingo.ai.docstructure.service.structure.geometry;

import com.flamingo.ai.docstructure.service.structure.model.Position;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Encodes geometry fragments as inline tags appended to chunk text.
 *
 * <p>Tag grammar: {@code "@@" page "\t" left "\t" right "\t" top "\t" bottom "##"}, each spatial
 * field with exactly one fractional digit. Downstream consumers parse the tags themselves.
 */
public final class GeometryTagger {

  private GeometryTagger() {}

  /**
   * Encodes one fragment.
   *
   * @param position fragment to encode
   * @return the tag, or an empty string when the fragment carries no geometry
   */
  public static String tag(Position position) {
    if (position == null || position.isEmpty()) {
      return "";
    }
    return String.format(
        Locale.ROOT,
        "@@%d\t%.1f\t%.1f\t%.1f\t%.1f##",
        position.page(),
        position.left(),
        position.right(),
        position.top(),
        position.bottom());
  }

  /** Encodes all fragments of an item, tab separated. */
  public static String tags(List<Position> positions) {
    return positions.stream().map(GeometryTagger::tag).collect(Collectors.joining("\t"));
  }
}
