package com.flamingo.ai.docstructure.service.structure.qa;

import com.flamingo.ai.docstructure.service.structure.model.QaUnit;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one Q/A reconstruction run. Created per document and never shared.
 *
 * <p>The heading and level stacks always have the same length.
 */
final class QaReconstructionState {

  private final List<String> headingStack = new ArrayList<>();
  private final List<Integer> levelStack = new ArrayList<>();
  private final List<QaUnit> units = new ArrayList<>();
  private final StringBuilder answer = new StringBuilder();
  private BufferedImage pendingImage;
  private int page;

  int page() {
    return page;
  }

  void advancePage(int breaks) {
    page += breaks;
  }

  void appendAnswer(String text) {
    if (text == null || text.isBlank()) {
      return;
    }
    if (answer.length() > 0) {
      answer.append('\n');
    }
    answer.append(text);
  }

  void appendImage(BufferedImage image) {
    pendingImage = ImageConcatenator.concat(pendingImage, image);
  }

  boolean hasAnswer() {
    return answer.length() > 0;
  }

  boolean hasPendingContent() {
    return answer.length() > 0 || pendingImage != null;
  }

  /**
   * Emits the pending answer under the open heading path and clears it. Content collected before
   * any heading was opened has no question and is dropped.
   *
   * @return {@code true} if a unit was emitted
   */
  boolean flush() {
    boolean emitted = false;
    if (!headingStack.isEmpty()) {
      units.add(new QaUnit(List.copyOf(headingStack), answer.toString(), pendingImage));
      emitted = true;
    }
    answer.setLength(0);
    pendingImage = null;
    return emitted;
  }

  /** Closes every open heading at or below {@code level}, then opens the new heading. */
  void openHeading(String text, int level) {
    while (!levelStack.isEmpty() && level <= levelStack.get(levelStack.size() - 1)) {
      headingStack.remove(headingStack.size() - 1);
      levelStack.remove(levelStack.size() - 1);
    }
    headingStack.add(text);
    levelStack.add(level);
  }

  List<QaUnit> units() {
    return units;
  }
}
