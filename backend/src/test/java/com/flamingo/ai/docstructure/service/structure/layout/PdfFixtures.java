package com.flamingo.ai.docstructure.service.structure.layout;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;

/** Builds small PDFs in memory for layout and chunking tests. */
public final class PdfFixtures {

  public static final float PAGE_HEIGHT = PDRectangle.LETTER.getHeight();

  private PdfFixtures() {}

  /**
   * One page: a 24pt bold title, a two-line paragraph in 12pt with 14pt leading, and a second
   * paragraph separated by a wide gap. The outline holds the title with a nested child entry.
   */
  public static byte[] manual() throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDPage page = new PDPage(PDRectangle.LETTER);
      document.addPage(page);
      PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
      PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        line(content, bold, 24, 72, 700, "Chapter One");
        line(content, regular, 12, 72, 660, "First body line");
        line(content, regular, 12, 72, 646, "second body line");
        line(content, regular, 12, 72, 600, "Another paragraph");
      }

      PDDocumentOutline outline = new PDDocumentOutline();
      document.getDocumentCatalog().setDocumentOutline(outline);
      PDOutlineItem chapter = new PDOutlineItem();
      chapter.setTitle("Chapter One");
      outline.addLast(chapter);
      PDOutlineItem section = new PDOutlineItem();
      section.setTitle("Section 1.1");
      chapter.addLast(section);
      return save(document);
    }
  }

  /** {@code pages} pages, each with a single line "Page N". */
  public static byte[] pages(int pages) throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (int i = 1; i <= pages; i++) {
        PDPage page = new PDPage(PDRectangle.LETTER);
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          line(content, regular, 12, 72, 700, "Page " + i);
        }
      }
      return save(document);
    }
  }

  /**
   * One page: a heading, a ruled 2x3 table ({@code Part | Qty | Price}, {@code Bolt | 4 | 1.20})
   * spanning x 72..372 and y 700..660 (PDF space), and a closing paragraph below the table.
   */
  public static byte[] ruledTable() throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDPage page = new PDPage(PDRectangle.LETTER);
      document.addPage(page);
      PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        line(content, regular, 12, 72, 730, "Parts list");

        content.setLineWidth(0.5f);
        for (float y : new float[] {700, 680, 660}) {
          content.moveTo(72, y);
          content.lineTo(372, y);
        }
        for (float x : new float[] {72, 172, 272, 372}) {
          content.moveTo(x, 700);
          content.lineTo(x, 660);
        }
        content.stroke();

        String[][] cells = {{"Part", "Qty", "Price"}, {"Bolt", "4", "1.20"}};
        for (int r = 0; r < cells.length; r++) {
          for (int c = 0; c < cells[r].length; c++) {
            line(content, regular, 10, 77 + 100 * c, 686 - 20 * r, cells[r][c]);
          }
        }

        line(content, regular, 12, 72, 620, "Tighten all bolts before use.");
      }
      return save(document);
    }
  }

  private static void line(
      PDPageContentStream content, PDType1Font font, float size, float x, float y, String text)
      throws IOException {
    content.beginText();
    content.setFont(font, size);
    content.newLineAtOffset(x, y);
    content.showText(text);
    content.endText();
  }

  private static byte[] save(PDDocument document) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    document.save(out);
    return out.toByteArray();
  }
}
