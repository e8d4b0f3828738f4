package com.flamingo.ai.docstructure.service.structure.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.DocParagraph;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

@DisplayName("TikaDocReader Tests")
class TikaDocReaderTest {

  private TikaDocReader reader;
  private Method parseXhtmlMethod;

  private final List<DocParagraph> paragraphs = new ArrayList<>();
  private final List<TableGrid> tables = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    reader = new TikaDocReader();
    parseXhtmlMethod = TikaDocReader.class.getDeclaredMethod("parseXhtml", byte[].class);
    parseXhtmlMethod.setAccessible(true);
  }

  private void walk(String body) throws Exception {
    String xhtml =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>t</title></head><body>"
            + body
            + "</body></html>";
    Document dom =
        (Document) parseXhtmlMethod.invoke(reader, xhtml.getBytes(StandardCharsets.UTF_8));
    reader.walkBody(dom.getDocumentElement(), paragraphs, tables);
  }

  @Test
  @DisplayName("should turn h1-h6 into headings and paragraphs into body text")
  void shouldReadHeadingsAndBody() throws Exception {
    walk("<h1>Maintenance</h1><p>Check the oil.</p><h3>Filters</h3><li>Replace yearly</li>");

    assertThat(paragraphs)
        .extracting(DocParagraph::text, DocParagraph::headingLevel)
        .containsExactly(
            tuple("Maintenance", 1),
            tuple("Check the oil.", 0),
            tuple("Filters", 3),
            tuple("Replace yearly", 0));
    assertThat(paragraphs).allSatisfy(p -> assertThat(p.pageBreaks()).isZero());
  }

  @Test
  @DisplayName("should read tables row by row and keep them out of the paragraph stream")
  void shouldReadTables() throws Exception {
    walk(
        "<p>Intro</p><table><tbody><tr><th>Part</th><th>Qty</th></tr>"
            + "<tr><td>Bolt</td><td>4</td></tr></tbody></table>");

    assertThat(paragraphs).extracting(DocParagraph::text).containsExactly("Intro");
    assertThat(tables).hasSize(1);
    assertThat(tables.get(0).rows()).containsExactly(List.of("Part", "Qty"), List.of("Bolt", "4"));
  }

  @Test
  @DisplayName("should descend into wrapper elements")
  void shouldDescendIntoWrappers() throws Exception {
    walk("<section><div>Nested</div></section>");

    assertThat(paragraphs).extracting(DocParagraph::text).containsExactly("Nested");
  }

  @Test
  @DisplayName("should support only .doc files")
  void shouldSupportDoc() {
    assertThat(reader.supports("old.DOC")).isTrue();
    assertThat(reader.supports("new.docx")).isFalse();
  }

  @Test
  @DisplayName("should wrap a truncated Word file in a DocumentProcessingException")
  void shouldFail_whenTruncated() {
    byte[] truncated = new byte[24];
    byte[] ole2Magic = {
      (byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1
    };
    System.arraycopy(ole2Magic, 0, truncated, 0, ole2Magic.length);

    assertThatThrownBy(() -> reader.read("broken.doc", truncated))
        .isInstanceOf(DocumentProcessingException.class);
  }
}
