package com.flamingo.ai.docstructure.service.structure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.exception.LlmServiceException;
import com.flamingo.ai.docstructure.service.structure.hierarchy.HierarchicalDocumentReader;
import com.flamingo.ai.docstructure.service.structure.model.ChunkRequest;
import com.flamingo.ai.docstructure.service.structure.model.ChunkingResult;
import com.flamingo.ai.docstructure.service.structure.model.DocParagraph;
import com.flamingo.ai.docstructure.service.structure.model.DocumentSource;
import com.flamingo.ai.docstructure.service.structure.model.HierarchicalContent;
import com.flamingo.ai.docstructure.service.structure.model.IndexRecord;
import com.flamingo.ai.docstructure.service.structure.model.ParserConfig;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import com.flamingo.ai.docstructure.service.structure.model.RecordType;
import com.flamingo.ai.docstructure.service.structure.model.TableGrid;
import com.flamingo.ai.docstructure.service.structure.qa.QaReconstructor;
import com.flamingo.ai.docstructure.service.structure.table.TableNormalizer;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelClient;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelFactory;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HierarchicalDocumentChunkingStrategy Tests")
class HierarchicalDocumentChunkingStrategyTest {

  @Mock private HierarchicalDocumentReader reader;
  @Mock private VisionModelFactory visionModelFactory;
  @Mock private VisionModelClient visionModelClient;

  private HierarchicalDocumentChunkingStrategy strategy;
  private final List<String> progress = new ArrayList<>();
  private final ProgressListener listener = (p, message) -> progress.add(message);

  @BeforeEach
  void setUp() {
    strategy =
        new HierarchicalDocumentChunkingStrategy(
            List.of(reader),
            new QaReconstructor(),
            new TableNormalizer(),
            visionModelFactory,
            new StructureConfig());
    lenient().when(reader.supports(anyString())).thenAnswer(
        inv -> inv.<String>getArgument(0).endsWith(".docx"));
  }

  private static ChunkRequest request(String layoutRecognize) {
    return new ChunkRequest(
        DocumentSource.of("faq.docx", new byte[] {1}),
        0,
        100000,
        "Chinese",
        new ParserConfig(512, "\n", layoutRecognize));
  }

  private static DocParagraph picture(String text) {
    return new DocParagraph(text, 0, new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), 0);
  }

  private void readerReturns(List<DocParagraph> paragraphs, List<TableGrid> tables) {
    when(reader.read(eq("faq.docx"), any())).thenReturn(new HierarchicalContent(paragraphs, tables));
  }

  @Test
  @DisplayName("should support what any reader supports")
  void shouldDelegateSupportToReaders() {
    assertThat(strategy.supports("faq.docx")).isTrue();
    assertThat(strategy.supports("faq.pdf")).isFalse();
  }

  @Test
  @DisplayName("should emit tables first and one text record per question")
  void shouldEmitTablesThenQuestions() {
    readerReturns(
        List.of(
            DocParagraph.heading("Installation", 1),
            DocParagraph.body("Unpack the unit."),
            DocParagraph.heading("Wiring", 2),
            DocParagraph.body("Connect the ground first.")),
        List.of(new TableGrid(List.of(List.of("Pin", "Signal")), null)));

    ChunkingResult result = strategy.chunk(request("DeepDOC"), listener);

    assertThat(result.records())
        .extracting(IndexRecord::type)
        .containsExactly(RecordType.TABLE, RecordType.TEXT, RecordType.TEXT);
    assertThat(result.records().get(2).content())
        .isEqualTo("Installation\nWiring\nConnect the ground first.");
    assertThat(result.records()).allSatisfy(r -> assertThat(r.title()).isEqualTo("faq"));
    verify(visionModelFactory, never()).create(anyString());
  }

  @Test
  @DisplayName("should keep pictures as PNG images when no vision model is requested")
  void shouldKeepImages_withoutVisionModel() throws Exception {
    readerReturns(
        List.of(DocParagraph.heading("Front panel", 1), picture("See figure")), List.of());

    IndexRecord record = strategy.chunk(request("DeepDOC"), listener).records().get(0);

    assertThat(record.type()).isEqualTo(RecordType.IMAGE);
    assertThat(record.content()).isEqualTo("Front panel\nSee figure");
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(record.image()));
    assertThat(decoded.getWidth()).isEqualTo(4);
  }

  @Test
  @DisplayName("should transcribe pictures with the requested vision model")
  void shouldDescribeImages_withVisionModel() {
    when(visionModelFactory.create("gpt-4o")).thenReturn(visionModelClient);
    when(visionModelClient.describe(any(BufferedImage.class), anyString()))
        .thenReturn("Power switch on the left");
    readerReturns(
        List.of(DocParagraph.heading("Front panel", 1), picture("See figure")), List.of());

    IndexRecord record = strategy.chunk(request("gpt-4o"), listener).records().get(0);

    assertThat(record.type()).isEqualTo(RecordType.TEXT);
    assertThat(record.content())
        .isEqualTo("Front panel\nSee figure\n[Image Content]: Power switch on the left");
    assertThat(progress).contains("Using gpt-4o for image processing in DOCX.");
  }

  @Test
  @DisplayName("should keep images when the vision model cannot be created")
  void shouldKeepImages_whenVisionModelUnavailable() {
    when(visionModelFactory.create("gpt-4o"))
        .thenThrow(new LlmServiceException("No API key configured"));
    readerReturns(
        List.of(DocParagraph.heading("Front panel", 1), picture("See figure")), List.of());

    IndexRecord record = strategy.chunk(request("gpt-4o"), listener).records().get(0);

    assertThat(record.type()).isEqualTo(RecordType.IMAGE);
    assertThat(progress).isEmpty();
  }
}
