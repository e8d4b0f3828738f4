package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;

/** Helpers shared by the PDFBox based layout engines. */
final class PdfText {

  private static final Pattern BLANK_RUN = Pattern.compile("([\\t 　]|\\u3000){2,}");

  private PdfText() {}

  /** Trims and collapses runs of blanks (including ideographic spaces) into one space. */
  static String clean(String text) {
    if (text == null) {
      return "";
    }
    return BLANK_RUN.matcher(text.strip()).replaceAll(" ");
  }

  /**
   * Reads the bookmark tree depth first.
   *
   * @return entries in document order; depth 0 for top-level bookmarks
   */
  static List<OutlineEntry> readOutline(PDDocument document) {
    List<OutlineEntry> entries = new ArrayList<>();
    PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
    if (outline != null) {
      collect(outline.children(), 0, entries);
    }
    return entries;
  }

  private static void collect(Iterable<PDOutlineItem> items, int depth, List<OutlineEntry> out) {
    for (PDOutlineItem item : items) {
      String title = item.getTitle();
      if (title != null && !title.isBlank()) {
        out.add(new OutlineEntry(title.strip(), depth));
      }
      if (item.hasChildren()) {
        collect(item.children(), depth + 1, out);
      }
    }
  }

  /** First page to hand to a PDFBox stripper (1-based) for a 0-based {@code fromPage}. */
  static int startPage(int fromPage) {
    return Math.max(0, fromPage) + 1;
  }

  /** Last page to hand to a PDFBox stripper (1-based, inclusive) for an exclusive {@code toPage}. */
  static int endPage(PDDocument document, int toPage) {
    return Math.min(toPage, document.getNumberOfPages());
  }
}
