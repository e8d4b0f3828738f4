package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.layout.RulingTableDetector.DetectedTable;
import com.flamingo.ai.docstructure.service.structure.layout.RulingTableDetector.Glyph;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.LayoutResult;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import com.flamingo.ai.docstructure.service.structure.model.Position;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

/**
 * Deterministic layout engine built on the PDFBox text stripper.
 *
 * <p>Text is collected line by line with its font metrics and bounding box. Lines set in a font
 * clearly larger than the document median (or bold and larger) are labelled {@code title};
 * consecutive body lines that sit close together on one page are joined into a paragraph block
 * keeping one geometry fragment per line. Tables drawn with ruling lines are read cell by cell
 * (see {@link RulingTableDetector}) and their text is kept out of the blocks.
 */
@Component
@Slf4j
public class PdfBoxLayoutEngine implements LayoutEngine {

  public static final String ENGINE_NAME = "DeepDOC";

  static final String TITLE_LABEL = "title";
  static final String TEXT_LABEL = "text";

  private static final float TITLE_MULTIPLIER = 1.15f;
  private static final float PARAGRAPH_LEADING = 1.5f;
  private static final float WORD_GAP_FACTOR = 0.25f;
  private static final float SAME_LINE_TOLERANCE = 2.0f;
  private static final double DEFAULT_FONT_SIZE = 12.0;

  @Override
  public LayoutResult analyze(byte[] pdf, int fromPage, int toPage, ProgressListener listener) {
    long start = System.nanoTime();
    listener.onMessage("OCR started");
    try (PDDocument document = Loader.loadPDF(pdf)) {
      int startPage = PdfText.startPage(fromPage);
      int endPage = PdfText.endPage(document, toPage);
      if (startPage > endPage) {
        log.debug("Requested pages [{}, {}) are outside the document", fromPage, toPage);
        return new LayoutResult(List.of(), PdfText.readOutline(document), List.of());
      }

      LineCollector collector = new LineCollector(fromPage);
      collector.setStartPage(startPage);
      collector.setEndPage(endPage);
      collector.getText(document);
      List<LineInfo> lines = collector.getLines();
      listener.onMessage(String.format(Locale.ROOT, "OCR finished (%.2fs)", seconds(start)));

      start = System.nanoTime();
      double median = medianFontSize(lines);
      List<String> labels = lines.stream().map(line -> label(line, median)).toList();
      listener.onProgress(0.65, String.format(Locale.ROOT, "Layout analysis (%.2fs)", seconds(start)));

      start = System.nanoTime();
      List<DetectedTable> tables = new ArrayList<>();
      for (int pageNo = startPage; pageNo <= endPage; pageNo++) {
        int page = pageNo - fromPage;
        tables.addAll(
            RulingTableDetector.detect(
                page,
                RulingCollector.collect(document.getPage(pageNo - 1)),
                collector.getGlyphs(page)));
      }
      List<LineInfo> bodyLines = new ArrayList<>(lines.size());
      List<String> bodyLabels = new ArrayList<>(lines.size());
      for (int i = 0; i < lines.size(); i++) {
        Position position = lines.get(i).position();
        if (tables.stream().noneMatch(table -> table.contains(position))) {
          bodyLines.add(lines.get(i));
          bodyLabels.add(labels.get(i));
        }
      }
      listener.onProgress(0.67, String.format(Locale.ROOT, "Table analysis (%.2fs)", seconds(start)));

      start = System.nanoTime();
      List<Block> blocks = mergeParagraphs(bodyLines, bodyLabels);
      List<OutlineEntry> outline = PdfText.readOutline(document);
      listener.onProgress(0.68, String.format(Locale.ROOT, "Text merged (%.2fs)", seconds(start)));

      log.debug(
          "PDFBox layout: {} lines, {} blocks, {} tables, {} outline entries, median font size {}",
          lines.size(),
          blocks.size(),
          tables.size(),
          outline.size(),
          median);
      return new LayoutResult(
          blocks, outline, tables.stream().map(DetectedTable::toGrid).toList());
    } catch (IOException e) {
      log.error("PDFBox layout analysis failed: {}", e.getMessage());
      throw new DocumentProcessingException(null, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public String getEngineName() {
    return ENGINE_NAME;
  }

  // ---- private helpers ----

  private static double seconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  static double medianFontSize(List<LineInfo> lines) {
    List<Float> sizes = lines.stream().map(LineInfo::avgFontSize).sorted().toList();
    if (sizes.isEmpty()) {
      return DEFAULT_FONT_SIZE;
    }
    int mid = sizes.size() / 2;
    return sizes.size() % 2 == 0 ? (sizes.get(mid - 1) + sizes.get(mid)) / 2.0 : sizes.get(mid);
  }

  static String label(LineInfo line, double median) {
    float size = line.avgFontSize();
    boolean bold = line.fontName() != null && line.fontName().toLowerCase(Locale.ROOT).contains("bold");
    String text = line.text().strip();
    if (text.length() < 2 || text.length() > 200) {
      return TEXT_LABEL;
    }
    if (size > median * TITLE_MULTIPLIER || (bold && size > median)) {
      return TITLE_LABEL;
    }
    return TEXT_LABEL;
  }

  private static List<Block> mergeParagraphs(List<LineInfo> lines, List<String> labels) {
    List<Block> blocks = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    List<Position> positions = new ArrayList<>();
    LineInfo previous = null;

    for (int i = 0; i < lines.size(); i++) {
      LineInfo line = lines.get(i);
      String label = labels.get(i);
      boolean continues =
          previous != null
              && TEXT_LABEL.equals(label)
              && TEXT_LABEL.equals(labels.get(i - 1))
              && continuesParagraph(previous, line);
      if (!continues && text.length() > 0) {
        blocks.add(new Block(PdfText.clean(text.toString()), labels.get(i - 1), positions));
        text.setLength(0);
        positions = new ArrayList<>();
      }
      appendLine(text, line.text().strip());
      positions.add(line.position());
      previous = line;
    }
    if (text.length() > 0) {
      blocks.add(new Block(PdfText.clean(text.toString()), labels.get(lines.size() - 1), positions));
    }
    return blocks;
  }

  /** Lines continue a paragraph when their baselines are at most 1.5 font sizes apart. */
  private static boolean continuesParagraph(LineInfo previous, LineInfo line) {
    Position prev = previous.position();
    Position cur = line.position();
    if (prev.page() != cur.page()
        || Math.abs(previous.avgFontSize() - line.avgFontSize()) >= 1.0f) {
      return false;
    }
    double baselineGap = cur.bottom() - prev.bottom();
    return baselineGap > 0 && baselineGap <= PARAGRAPH_LEADING * line.avgFontSize();
  }

  /** Joins wrapped lines; ideographic text is joined without a separator. */
  static void appendLine(StringBuilder paragraph, String line) {
    if (line.isEmpty()) {
      return;
    }
    if (paragraph.length() > 0) {
      char last = paragraph.charAt(paragraph.length() - 1);
      if (!Character.isIdeographic(last) && !Character.isIdeographic(line.codePointAt(0))) {
        paragraph.append(' ');
      }
    }
    paragraph.append(line);
  }

  // ---- inner types ----

  /**
   * Metadata for a single line of text.
   *
   * @param text concatenated Unicode text of the line
   * @param avgFontSize average font size across all positions in the line
   * @param fontName name of the dominant font (may contain "Bold" for bold fonts)
   * @param position page (relative to the first requested page) and bounding box
   */
  record LineInfo(String text, float avgFontSize, String fontName, Position position) {}

  /** Collects per-line font metrics and bounding boxes during PDFTextStripper traversal. */
  private static final class LineCollector extends PDFTextStripper {

    private final int fromPage;
    private final List<LineInfo> lines = new ArrayList<>();
    private final List<TextPosition> currentLine = new ArrayList<>();
    private final Map<Integer, List<Glyph>> glyphs = new HashMap<>();
    private float lastY = Float.NaN;

    LineCollector(int fromPage) throws IOException {
      super();
      this.fromPage = fromPage;
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      List<Glyph> pageGlyphs =
          glyphs.computeIfAbsent(getCurrentPageNo() - fromPage, page -> new ArrayList<>());
      for (TextPosition pos : textPositions) {
        pageGlyphs.add(Glyph.of(pos));
        float y = pos.getYDirAdj();
        if (Float.isNaN(lastY) || Math.abs(y - lastY) > SAME_LINE_TOLERANCE) {
          flushLine();
          lastY = y;
        }
        currentLine.add(pos);
      }
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      lastY = Float.NaN;
      super.endPage(page);
    }

    private void flushLine() {
      if (currentLine.isEmpty()) {
        return;
      }
      String text = lineText(currentLine);
      if (!text.isBlank()) {
        lines.add(toLine(text));
      }
      currentLine.clear();
    }

    /** Concatenates glyphs, inserting a space where the horizontal gap between glyphs is wide. */
    private static String lineText(List<TextPosition> positions) {
      StringBuilder text = new StringBuilder();
      TextPosition previous = null;
      for (TextPosition pos : positions) {
        String unicode = pos.getUnicode() == null ? "" : pos.getUnicode();
        if (previous != null && text.length() > 0 && !unicode.isBlank()) {
          float gap = pos.getXDirAdj() - (previous.getXDirAdj() + previous.getWidthDirAdj());
          char last = text.charAt(text.length() - 1);
          if (!Character.isWhitespace(last) && gap > pos.getFontSizeInPt() * WORD_GAP_FACTOR) {
            text.append(' ');
          }
        }
        text.append(unicode);
        previous = pos;
      }
      return text.toString();
    }

    private LineInfo toLine(String text) {
      float avgSize =
          (float)
              currentLine.stream()
                  .mapToDouble(TextPosition::getFontSizeInPt)
                  .filter(s -> s > 0)
                  .average()
                  .orElse(DEFAULT_FONT_SIZE);
      String fontName =
          currentLine.stream()
              .map(p -> p.getFont() != null ? p.getFont().getName() : null)
              .filter(n -> n != null && !n.isBlank())
              .findFirst()
              .orElse("");

      double left = Double.MAX_VALUE;
      double right = 0;
      double top = Double.MAX_VALUE;
      double bottom = 0;
      for (TextPosition pos : currentLine) {
        left = Math.min(left, pos.getXDirAdj());
        right = Math.max(right, pos.getXDirAdj() + pos.getWidthDirAdj());
        top = Math.min(top, pos.getYDirAdj() - pos.getHeightDir());
        bottom = Math.max(bottom, pos.getYDirAdj());
      }
      int page = getCurrentPageNo() - fromPage;
      return new LineInfo(text, avgSize, fontName, new Position(page, left, right, top, bottom));
    }

    List<LineInfo> getLines() {
      return lines;
    }

    /** Glyphs of a page in reading order; page numbers as in {@link Position#page()}. */
    List<Glyph> getGlyphs(int page) {
      return glyphs.getOrDefault(page, List.of());
    }
  }
}
