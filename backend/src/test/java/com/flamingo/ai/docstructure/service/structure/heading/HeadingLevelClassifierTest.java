package com.flamingo.ai.docstructure.service.structure.heading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HeadingLevelClassifier Tests")
class HeadingLevelClassifierTest {

  @Mock private OutlineMatchingStrategy outlineMatchingStrategy;
  @Mock private BulletFrequencyStrategy bulletFrequencyStrategy;

  private HeadingLevelClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier =
        new HeadingLevelClassifier(
            outlineMatchingStrategy, bulletFrequencyStrategy, new StructureConfig());
  }

  private static List<Block> blocks(int count) {
    List<Block> blocks = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      blocks.add(Block.withoutPosition("block " + i, "text"));
    }
    return blocks;
  }

  @Test
  @DisplayName("should trust a dense outline")
  void shouldSelectOutline_whenDense() {
    HeadingLevelStrategy selected =
        classifier.select(blocks(10), List.of(new OutlineEntry("Intro", 0)));

    assertThat(selected).isSameAs(outlineMatchingStrategy);
  }

  @Test
  @DisplayName("should fall back to bullets when the outline ratio is not above 0.03")
  void shouldSelectBullets_whenOutlineSparse() {
    List<OutlineEntry> outline =
        List.of(new OutlineEntry("a", 0), new OutlineEntry("b", 0), new OutlineEntry("c", 0));

    assertThat(classifier.select(blocks(100), outline)).isSameAs(bulletFrequencyStrategy);
    assertThat(classifier.select(blocks(10), List.of())).isSameAs(bulletFrequencyStrategy);
  }

  @Test
  @DisplayName("should return the strategy result when it covers every block")
  void shouldReturnLevels() {
    List<Block> blocks = blocks(2);
    HeadingLevels levels = new HeadingLevels(List.of(1, 2), 1);
    when(bulletFrequencyStrategy.classify(blocks, List.of())).thenReturn(levels);
    when(bulletFrequencyStrategy.getStrategyName()).thenReturn("bullet-frequency");

    assertThat(classifier.classify(blocks, List.of())).isSameAs(levels);
    verify(bulletFrequencyStrategy).classify(blocks, List.of());
  }

  @Test
  @DisplayName("should fail fast when the level count differs from the block count")
  void shouldFail_whenLevelCountMismatch() {
    List<Block> blocks = blocks(2);
    when(bulletFrequencyStrategy.classify(blocks, List.of()))
        .thenReturn(new HeadingLevels(List.of(1), 1));
    when(bulletFrequencyStrategy.getStrategyName()).thenReturn("bullet-frequency");

    assertThatThrownBy(() -> classifier.classify(blocks, List.of()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("does not match block count 2");
  }
}
