package com.flamingo.ai.docstructure.service.structure.heading;

import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Infers heading levels from the dominant bullet/numbering style of the document.
 *
 * <p>Lines matching a pattern of the dominant {@link BulletCategory} take that pattern's index as
 * level. Lines the layout engine labelled as a title or header, and which read like a title, sit
 * one level below the deepest pattern. Everything else is body text. The pivot is the most
 * frequent heading level.
 */
@Component
@Slf4j
public class BulletFrequencyStrategy implements HeadingLevelStrategy {

  private static final Pattern TITLE_LAYOUT = Pattern.compile("(title|head)");
  private static final Pattern LEGAL_ARTICLE = Pattern.compile("第[零一二三四五六七八九十百0-9]+条");
  private static final Pattern SENTENCE_PUNCTUATION = Pattern.compile("[,;，。；！!]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public HeadingLevels classify(List<Block> blocks, List<OutlineEntry> outline) {
    List<String> texts = blocks.stream().map(Block::text).toList();
    Optional<BulletCategory> detected = BulletCategory.mostFrequent(texts);

    if (detected.isEmpty() || blocks.isEmpty()) {
      // No numbering style: every block at one level, no section boundaries
      log.debug("No bullet style detected across {} blocks", blocks.size());
      return new HeadingLevels(new ArrayList<>(Collections.nCopies(blocks.size(), 1)), 1);
    }

    BulletCategory category = detected.get();
    int titleLevel = category.size();
    int bodyLevel = titleLevel + 1;

    List<Integer> levels = new ArrayList<>(blocks.size());
    for (Block block : blocks) {
      String text = block.text().strip();
      Optional<Integer> level = category.levelOf(text);
      if (level.isPresent()) {
        levels.add(level.get());
      } else if (TITLE_LAYOUT.matcher(block.layoutLabel()).find()
          && !isNotTitle(text.split("@", -1)[0])) {
        levels.add(titleLevel);
      } else {
        levels.add(bodyLevel);
      }
    }

    int pivot = mostFrequentHeadingLevel(levels, titleLevel).orElse(bodyLevel);
    log.debug("Bullet style {} selected, pivot level {}", category, pivot);
    return new HeadingLevels(levels, pivot);
  }

  @Override
  public String getStrategyName() {
    return "bullet-frequency";
  }

  /** Most frequent level not deeper than {@code maxLevel}; ties go to the first seen. */
  private Optional<Integer> mostFrequentHeadingLevel(List<Integer> levels, int maxLevel) {
    Map<Integer, Integer> counts = new LinkedHashMap<>();
    for (Integer level : levels) {
      counts.merge(level, 1, Integer::sum);
    }
    Integer best = null;
    int bestCount = 0;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      if (entry.getKey() <= maxLevel && entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return Optional.ofNullable(best);
  }

  static boolean isNotTitle(String text) {
    if (LEGAL_ARTICLE.matcher(text).lookingAt()) {
      return false;
    }
    String trimmed = text.strip();
    int words = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    if (words > 12 || (text.indexOf(' ') < 0 && text.length() >= 32)) {
      return true;
    }
    return SENTENCE_PUNCTUATION.matcher(text).find();
  }
}
