package com.flamingo.ai.docstructure.service.structure.heading;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chooses how heading levels are inferred for a document and runs that strategy.
 *
 * <p>The outline is trusted only when it is dense enough relative to the number of blocks;
 * otherwise levels come from bullet frequency analysis.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HeadingLevelClassifier {

  private final OutlineMatchingStrategy outlineMatchingStrategy;
  private final BulletFrequencyStrategy bulletFrequencyStrategy;
  private final StructureConfig structureConfig;

  /**
   * Infers a level for every block.
   *
   * @param blocks all blocks of the document
   * @param outline outline entries, possibly empty
   * @return levels and pivot
   * @throws IllegalStateException if the strategy returns a level count different from the block
   *     count
   */
  public HeadingLevels classify(List<Block> blocks, List<OutlineEntry> outline) {
    HeadingLevelStrategy strategy = select(blocks, outline);
    log.debug(
        "Classifying {} blocks with {} strategy ({} outline entries)",
        blocks.size(),
        strategy.getStrategyName(),
        outline.size());

    HeadingLevels result = strategy.classify(blocks, outline);
    if (result.levels().size() != blocks.size()) {
      throw new IllegalStateException(
          String.format(
              "Heading level count %d does not match block count %d",
              result.levels().size(), blocks.size()));
    }
    return result;
  }

  HeadingLevelStrategy select(List<Block> blocks, List<OutlineEntry> outline) {
    if (!blocks.isEmpty()
        && !outline.isEmpty()
        && (double) outline.size() / blocks.size()
            > structureConfig.getOutline().getMinDensity()) {
      return outlineMatchingStrategy;
    }
    return bulletFrequencyStrategy;
  }
}
