package com.flamingo.ai.docstructure.service.structure.model;

import java.util.List;

/**
 * Everything a layout engine extracted from the requested pages of a PDF.
 *
 * @param blocks text blocks in extraction order
 * @param outline bookmark outline; empty when the source has none or the engine cannot read it
 * @param tables tables detected by the engine
 */
public record LayoutResult(List<Block> blocks, List<OutlineEntry> outline, List<TableGrid> tables) {

  public static LayoutResult empty() {
    return new LayoutResult(List.of(), List.of(), List.of());
  }
}
