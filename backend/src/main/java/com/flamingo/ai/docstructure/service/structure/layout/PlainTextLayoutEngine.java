package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.LayoutResult;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts the text layer only: one block per non-blank line, without geometry. */
@Component
@Slf4j
public class PlainTextLayoutEngine implements LayoutEngine {

  public static final String ENGINE_NAME = "Plain Text";

  @Override
  public LayoutResult analyze(byte[] pdf, int fromPage, int toPage, ProgressListener listener) {
    long start = System.nanoTime();
    listener.onMessage("OCR started");
    try (PDDocument document = Loader.loadPDF(pdf)) {
      List<OutlineEntry> outline = PdfText.readOutline(document);
      int startPage = PdfText.startPage(fromPage);
      int endPage = PdfText.endPage(document, toPage);
      if (startPage > endPage) {
        return new LayoutResult(List.of(), outline, List.of());
      }

      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      stripper.setStartPage(startPage);
      stripper.setEndPage(endPage);
      List<Block> blocks =
          stripper
              .getText(document)
              .lines()
              .map(PdfText::clean)
              .filter(line -> !line.isEmpty())
              .map(line -> Block.withoutPosition(line, ""))
              .toList();
      listener.onProgress(
          0.68,
          String.format(
              Locale.ROOT, "Text extracted (%.2fs)", (System.nanoTime() - start) / 1_000_000_000.0));

      log.debug("Plain text layout: {} lines, {} outline entries", blocks.size(), outline.size());
      return new LayoutResult(blocks, outline, List.of());
    } catch (IOException e) {
      log.error("Plain text extraction failed: {}", e.getMessage());
      throw new DocumentProcessingException(null, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public String getEngineName() {
    return ENGINE_NAME;
  }
}
