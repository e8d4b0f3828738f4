package com.flamingo.ai.docstructure.service.structure.heading;

import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.List;

/**
 * Infers one heading level per block plus the document's pivot level.
 *
 * <p>{@link HeadingLevelClassifier} picks exactly one implementation per document.
 */
public interface HeadingLevelStrategy {

  /**
   * Classifies every block.
   *
   * @param blocks all blocks of the document, in extraction order
   * @param outline outline entries; may be empty
   * @return levels in block order and the pivot level
   */
  HeadingLevels classify(List<Block> blocks, List<OutlineEntry> outline);

  /** Short name used in logs. */
  String getStrategyName();
}
