package com.flamingo.ai.docstructure.service.structure.heading;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Families of bullet and numbering styles. Within a family, pattern order is heading order: the
 * index of the first pattern matching the start of a line is that line's level.
 */
public enum BulletCategory {
  CHINESE_LEGAL(
      "第[零一二三四五六七八九十百0-9]+(分?编|部分)",
      "第[零一二三四五六七八九十百0-9]+章",
      "第[零一二三四五六七八九十百0-9]+节",
      "第[零一二三四五六七八九十百0-9]+条",
      "[\\(（][零一二三四五六七八九十百]+[\\)）]"),
  ARABIC_NUMBERING(
      "第[0-9]+章",
      "第[0-9]+节",
      "[0-9]{0,2}[\\. 、]",
      "[0-9]{0,2}\\.[0-9]{0,2}[^a-zA-Z/%~-]",
      "[0-9]{0,2}\\.[0-9]{0,2}\\.[0-9]{0,2}",
      "[0-9]{0,2}\\.[0-9]{0,2}\\.[0-9]{0,2}\\.[0-9]{0,2}"),
  CHINESE_NUMBERING(
      "第[零一二三四五六七八九十百0-9]+章",
      "第[零一二三四五六七八九十百0-9]+节",
      "[零一二三四五六七八九十百]+[ 、]",
      "[\\(（][零一二三四五六七八九十百]+[\\)）]",
      "[\\(（][0-9]{0,2}[\\)）]"),
  ENGLISH(
      "PART (ONE|TWO|THREE|FOUR|FIVE|SIX|SEVEN|EIGHT|NINE|TEN)",
      "Chapter (I+V?|VI*|XI|IX|X)",
      "Section [0-9]+",
      "Article [0-9]+"),
  MARKDOWN("#[^#]", "##[^#]", "###.*", "####.*", "#####.*", "######.*");

  /** Lines that start like numbers or quantities rather than bullets. */
  private static final List<Pattern> NOT_BULLET =
      List.of(
          Pattern.compile("0"),
          Pattern.compile("[0-9]+ +[0-9~个只-]"),
          Pattern.compile("[0-9]+\\.{2,}"));

  private final List<Pattern> patterns;

  BulletCategory(String... regexes) {
    this.patterns = Arrays.stream(regexes).map(Pattern::compile).toList();
  }

  /** Number of heading levels this family distinguishes. */
  public int size() {
    return patterns.size();
  }

  /**
   * Returns the level of the first pattern matching the start of {@code line}.
   *
   * @param line stripped line text
   * @return pattern index, or empty when no pattern matches or the line is not a bullet
   */
  public Optional<Integer> levelOf(String line) {
    if (isNotBullet(line)) {
      return Optional.empty();
    }
    for (int i = 0; i < patterns.size(); i++) {
      if (patterns.get(i).matcher(line).lookingAt()) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  /**
   * Picks the family matching the most lines; ties go to the earlier family.
   *
   * @param texts block texts
   * @return the dominant family, or empty when no line matches any family
   */
  public static Optional<BulletCategory> mostFrequent(List<String> texts) {
    BulletCategory best = null;
    int bestHits = 0;
    for (BulletCategory category : values()) {
      int hits = 0;
      for (String text : texts) {
        if (category.levelOf(text.strip()).isPresent()) {
          hits++;
        }
      }
      if (hits > bestHits) {
        best = category;
        bestHits = hits;
      }
    }
    return Optional.ofNullable(best);
  }

  static boolean isNotBullet(String line) {
    return NOT_BULLET.stream().anyMatch(p -> p.matcher(line).lookingAt());
  }
}
