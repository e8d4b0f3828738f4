package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.vision.VisionModelFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@code layout_recognize} option to a layout engine. {@code DeepDOC} and {@code
 * Plain Text} map to the built-in engines; any other value names a vision model.
 */
@Component
@RequiredArgsConstructor
public class LayoutEngineSelector {

  private final PdfBoxLayoutEngine pdfBoxLayoutEngine;
  private final PlainTextLayoutEngine plainTextLayoutEngine;
  private final VisionModelFactory visionModelFactory;
  private final StructureConfig structureConfig;

  /**
   * Returns the engine for the option.
   *
   * @throws com.flamingo.ai.docstructure.exception.LlmServiceException if a vision model is named
   *     but cannot be created
   */
  public LayoutEngine select(String layoutRecognize) {
    if (layoutRecognize == null
        || layoutRecognize.isBlank()
        || PdfBoxLayoutEngine.ENGINE_NAME.equals(layoutRecognize)) {
      return pdfBoxLayoutEngine;
    }
    if (PlainTextLayoutEngine.ENGINE_NAME.equals(layoutRecognize)) {
      return plainTextLayoutEngine;
    }
    StructureConfig.Vision vision = structureConfig.getVision();
    return new VisionLayoutEngine(
        visionModelFactory.create(layoutRecognize), vision.getPrompt(), vision.getDpi());
  }

  /** The deterministic engine used when a vision engine fails. */
  public LayoutEngine fallback() {
    return pdfBoxLayoutEngine;
  }

  /** {@code true} when the option names a vision model rather than a built-in engine. */
  public static boolean isVisionModel(String layoutRecognize) {
    return layoutRecognize != null
        && !layoutRecognize.isBlank()
        && !PdfBoxLayoutEngine.ENGINE_NAME.equals(layoutRecognize)
        && !PlainTextLayoutEngine.ENGINE_NAME.equals(layoutRecognize);
  }
}
