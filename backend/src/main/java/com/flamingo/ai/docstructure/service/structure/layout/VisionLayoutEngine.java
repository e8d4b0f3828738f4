package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.exception.DocumentProcessingException;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.LayoutResult;
import com.flamingo.ai.docstructure.service.structure.model.ProgressListener;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelClient;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/**
 * Renders each requested page and lets a vision model transcribe it to Markdown.
 *
 * <p>Every page becomes one block without geometry; tables stay inline as HTML in the page text.
 * No outline is produced. Created per request because the model is chosen by the request.
 */
@Slf4j
public class VisionLayoutEngine implements LayoutEngine {

  private final VisionModelClient client;
  private final String prompt;
  private final float dpi;

  public VisionLayoutEngine(VisionModelClient client, String prompt, float dpi) {
    this.client = client;
    this.prompt = prompt;
    this.dpi = dpi;
  }

  /**
   * {@inheritDoc}
   *
   * @throws com.flamingo.ai.docstructure.exception.LlmServiceException if the model fails on any
   *     page
   */
  @Override
  public LayoutResult analyze(byte[] pdf, int fromPage, int toPage, ProgressListener listener) {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int first = Math.max(0, fromPage);
      int last = Math.min(toPage, document.getNumberOfPages());
      List<Block> blocks = new ArrayList<>();

      for (int pageIndex = first; pageIndex < last; pageIndex++) {
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        String text = client.describe(image, prompt).strip();
        if (!text.isEmpty()) {
          blocks.add(Block.withoutPosition(text, ""));
        }
        double done = (double) (pageIndex - first + 1) / (last - first);
        listener.onProgress(
            0.1 + 0.6 * done, "Page " + (pageIndex + 1) + " processed by " + client.getModelName());
      }

      log.debug(
          "Vision layout with {}: {} pages, {} blocks", client.getModelName(), last - first, blocks.size());
      return new LayoutResult(blocks, List.of(), List.of());
    } catch (IOException e) {
      throw new DocumentProcessingException(null, "Failed to render PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public String getEngineName() {
    return client.getModelName();
  }
}
