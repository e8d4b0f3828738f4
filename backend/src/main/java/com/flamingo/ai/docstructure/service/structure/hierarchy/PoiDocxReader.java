package com.flamingo.ai.docstructure.service.structure.hierarchy;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.DocParagraph;
import com.flamingo.ai.docstructure.service.structure.model.HierarchicalContent;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPicture;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;
import org.springframework.stereotype.Component;

/**
 * Reads {@code .docx} files with Apache POI.
 *
 * <p>Heading levels come from the paragraph style ({@code Heading 1} .. {@code Heading 9}, or the
 * Chinese {@code 标题 N}), matched against the style name and the style id. Each paragraph
 * reports the first embedded picture it contains and how many of its runs end a page. Table rows
 * repeat a horizontally merged cell once per spanned grid column.
 */
@Component
@Slf4j
public class PoiDocxReader implements HierarchicalDocumentReader {

  private static final Pattern HEADING_STYLE =
      Pattern.compile("^(heading|标题)\\s*(\\d+)$", Pattern.CASE_INSENSITIVE);

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".docx");
  }

  @Override
  public HierarchicalContent read(String documentName, byte[] content) {
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
      List<DocParagraph> paragraphs = new ArrayList<>();
      for (XWPFParagraph paragraph : document.getParagraphs()) {
        paragraphs.add(toParagraph(document, paragraph));
      }
      List<TableGrid> tables = new ArrayList<>();
      for (XWPFTable table : document.getTables()) {
        tables.add(toGrid(table));
      }
      log.debug(
          "Read {} paragraphs and {} tables from {}", paragraphs.size(), tables.size(), documentName);
      return new HierarchicalContent(paragraphs, tables);
    } catch (IOException | RuntimeException e) {
      log.error("DOCX parsing failed for {}: {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to parse DOCX: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private DocParagraph toParagraph(XWPFDocument document, XWPFParagraph paragraph) {
    String text = paragraph.getText() == null ? "" : paragraph.getText().replace('\u3000', ' ');
    int level = headingLevel(document, paragraph.getStyle());
    BufferedImage image = null;
    int pageBreaks = 0;
    for (XWPFRun run : paragraph.getRuns()) {
      if (image == null) {
        image = firstPicture(run);
      }
      if (endsPage(run.getCTR())) {
        pageBreaks++;
      }
    }
    return new DocParagraph(text, level, image, pageBreaks);
  }

  static int headingLevel(XWPFDocument document, String styleId) {
    if (styleId == null || styleId.isBlank()) {
      return 0;
    }
    int level = parseHeadingLevel(styleId);
    if (level > 0 || document.getStyles() == null) {
      return level;
    }
    XWPFStyle style = document.getStyles().getStyle(styleId);
    return style == null ? 0 : parseHeadingLevel(style.getName());
  }

  static int parseHeadingLevel(String styleName) {
    if (styleName == null) {
      return 0;
    }
    Matcher matcher = HEADING_STYLE.matcher(styleName.strip());
    if (!matcher.matches()) {
      return 0;
    }
    try {
      return Integer.parseInt(matcher.group(2));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private BufferedImage firstPicture(XWPFRun run) {
    for (XWPFPicture picture : run.getEmbeddedPictures()) {
      if (picture.getPictureData() == null) {
        continue;
      }
      try {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(picture.getPictureData().getData()));
        if (image != null) {
          return image;
        }
      } catch (IOException e) {
        log.warn("Could not decode embedded picture {}: {}", picture.getDescription(), e.getMessage());
      }
    }
    return null;
  }

  /** A run ends a page when Word rendered a page break in it, or it holds an explicit page break. */
  static boolean endsPage(CTR run) {
    if (run.sizeOfLastRenderedPageBreakArray() > 0) {
      return true;
    }
    for (CTBr br : run.getBrList()) {
      if (br.isSetType() && br.getType() == STBrType.PAGE) {
        return true;
      }
    }
    return false;
  }

  private TableGrid toGrid(XWPFTable table) {
    List<List<String>> rows = new ArrayList<>();
    for (XWPFTableRow row : table.getRows()) {
      List<String> cells = new ArrayList<>();
      for (XWPFTableCell cell : row.getTableCells()) {
        String text = cell.getText() == null ? "" : cell.getText();
        cells.addAll(Collections.nCopies(gridSpan(cell), text));
      }
      rows.add(cells);
    }
    return new TableGrid(rows, null);
  }

  private static int gridSpan(XWPFTableCell cell) {
    CTTcPr properties = cell.getCTTc().getTcPr();
    if (properties == null || !properties.isSetGridSpan()) {
      return 1;
    }
    return Math.max(1, properties.getGridSpan().getVal().intValue());
  }
}
