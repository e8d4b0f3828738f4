package com.flamingo.ai.docstructure.service.structure.qa;

import com.flamingo.ai.docstructure.service.structure.model.DocParagraph;
import com.flamingo.ai.docstructure.service.structure.model.QaUnit;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds nested question/answer units from a linear paragraph stream.
 *
 * <p>Headings (levels 1 to 6) are questions; the body paragraphs that follow a heading are its
 * answer. An open-heading stack tracks the question path: a heading pops every open heading at
 * the same or a deeper level before it is pushed. Whenever a heading arrives and an answer is
 * pending, the answer is emitted under the current path.
 *
 * <p>Pictures in body paragraphs become text through an {@link ImageDescriber} when one is
 * given; otherwise, or when the describer fails, they are stacked into the answer image.
 */
@Service
@Slf4j
public class QaReconstructor {

  static final int MAX_HEADING_LEVEL = 6;
  static final String IMAGE_CONTENT_LABEL = "[Image Content]: ";

  /**
   * Reconstructs units from the paragraphs of pages {@code [fromPage, toPage)}.
   *
   * @param paragraphs paragraphs in document order
   * @param fromPage first page to interpret (0-based)
   * @param toPage page to stop before
   * @param describer image describer, or {@code null} to keep pictures as images
   * @return emitted units in document order
   */
  public List<QaUnit> reconstruct(
      List<DocParagraph> paragraphs, int fromPage, int toPage, ImageDescriber describer) {
    QaReconstructionState state = new QaReconstructionState();

    for (DocParagraph paragraph : paragraphs) {
      if (state.page() > toPage) {
        break;
      }
      if (fromPage <= state.page() && state.page() < toPage) {
        accept(state, paragraph, describer);
      }
      state.advancePage(paragraph.pageBreaks());
    }

    if (state.hasAnswer()) {
      state.flush();
    }

    log.debug("Reconstructed {} Q/A units from {} paragraphs", state.units().size(), paragraphs.size());
    return state.units();
  }

  private void accept(QaReconstructionState state, DocParagraph paragraph, ImageDescriber describer) {
    String text = paragraph.text() == null ? "" : paragraph.text().strip();
    int level = text.isEmpty() ? 0 : paragraph.headingLevel();

    if (level <= 0 || level > MAX_HEADING_LEVEL) {
      appendBody(state, text, paragraph, describer);
      return;
    }

    if (state.hasPendingContent()) {
      state.flush();
    }
    state.openHeading(text, level);
  }

  private void appendBody(
      QaReconstructionState state, String text, DocParagraph paragraph, ImageDescriber describer) {
    if (paragraph.image() == null || describer == null) {
      state.appendAnswer(text);
      state.appendImage(paragraph.image());
      return;
    }
    try {
      String description = describer.describe(paragraph.image());
      state.appendAnswer(text + "\n" + IMAGE_CONTENT_LABEL + description);
    } catch (RuntimeException e) {
      log.warn("Image description failed: {}. Keeping the original image.", e.getMessage());
      state.appendAnswer(text);
      state.appendImage(paragraph.image());
    }
  }
}
