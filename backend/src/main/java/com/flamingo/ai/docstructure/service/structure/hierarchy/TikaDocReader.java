package com.flamingo.ai.docstructure.service.structure.hierarchy;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.DocParagraph;
import com.flamingo.ai.docstructure.service.structure.model.HierarchicalContent;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads legacy {@code .doc} files through Tika's XHTML rendering.
 *
 * <p>{@code <h1>}..{@code <h6>} become headings, {@code <p>}, {@code <div>} and {@code <li>}
 * become body paragraphs and {@code <table>} elements become table grids. The binary format
 * exposes neither pictures nor page breaks here, so paragraphs carry none.
 */
@Component
@Slf4j
public class TikaDocReader implements HierarchicalDocumentReader {

  private static final String DOC_MIME_TYPE = "application/msword";

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".doc");
  }

  @Override
  public HierarchicalContent read(String documentName, byte[] content) {
    try {
      org.w3c.dom.Document dom = parseXhtml(toXhtml(content));
      List<DocParagraph> paragraphs = new ArrayList<>();
      List<TableGrid> tables = new ArrayList<>();
      walkBody(dom.getDocumentElement(), paragraphs, tables);
      log.debug(
          "Read {} paragraphs and {} tables from {}", paragraphs.size(), tables.size(), documentName);
      return new HierarchicalContent(paragraphs, tables);
    } catch (IOException | SAXException | TikaException | ParserConfigurationException e) {
      log.error("Tika parsing failed for {}: {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to parse document: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private byte[] toXhtml(byte[] content) throws IOException, SAXException, TikaException {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, DOC_MIME_TYPE);
    tikaParser.parse(new ByteArrayInputStream(content), handler, metadata);
    return out.toByteArray();
  }

  private org.w3c.dom.Document parseXhtml(byte[] xhtml)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    dom.getDocumentElement().normalize();
    return dom;
  }

  void walkBody(Element root, List<DocParagraph> paragraphs, List<TableGrid> tables) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = tagName(el);

      if (tag.matches("h[1-6]")) {
        paragraphs.add(DocParagraph.heading(el.getTextContent().strip(), tag.charAt(1) - '0'));
      } else if ("table".equals(tag)) {
        tables.add(toGrid(el));
      } else if ("p".equals(tag) || "div".equals(tag) || "li".equals(tag)) {
        paragraphs.add(DocParagraph.body(el.getTextContent().strip()));
      } else if (!"head".equals(tag)) {
        walkBody(el, paragraphs, tables);
      }
    }
  }

  private TableGrid toGrid(Element tableEl) {
    List<List<String>> rows = new ArrayList<>();
    NodeList rowNodes = tableEl.getElementsByTagNameNS("*", "tr");
    for (int r = 0; r < rowNodes.getLength(); r++) {
      NodeList cellNodes = rowNodes.item(r).getChildNodes();
      List<String> cells = new ArrayList<>();
      for (int c = 0; c < cellNodes.getLength(); c++) {
        Node cell = cellNodes.item(c);
        if (cell.getNodeType() != Node.ELEMENT_NODE) {
          continue;
        }
        String cellTag = tagName((Element) cell);
        if ("td".equals(cellTag) || "th".equals(cellTag)) {
          cells.add(cell.getTextContent().strip());
        }
      }
      if (!cells.isEmpty()) {
        rows.add(cells);
      }
    }
    return new TableGrid(rows, null);
  }

  private static String tagName(Element el) {
    String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return tag.toLowerCase(Locale.ROOT);
  }
}
