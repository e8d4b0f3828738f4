package com.flamingo.ai.docstructure.service.structure.heading;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.model.Block;
import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import com.flamingo.ai.docstructure.service.structure.model.OutlineEntry;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OutlineMatchingStrategy Tests")
class OutlineMatchingStrategyTest {

  private OutlineMatchingStrategy strategy;

  @BeforeEach
  void setUp() {
    strategy = new OutlineMatchingStrategy(new StructureConfig());
  }

  private static Block block(String text) {
    return Block.withoutPosition(text, "text");
  }

  @Test
  @DisplayName("should assign outline levels to matching blocks and body level to the rest")
  void shouldAssignOutlineLevels() {
    List<Block> blocks =
        List.of(
            block("Introduction"),
            block("Some body text about the product"),
            block("Installation Guide"));
    List<OutlineEntry> outline =
        List.of(new OutlineEntry("Introduction", 0), new OutlineEntry("Installation Guide", 1));

    HeadingLevels result = strategy.classify(blocks, outline);

    assertThat(result.levels()).containsExactly(0, 2, 1);
    assertThat(result.pivotLevel()).isZero();
  }

  @Test
  @DisplayName("should match a block that starts with the outline text")
  void shouldMatchPrefixOfLongerBlock() {
    List<Block> blocks = List.of(block("第一章 总则 本章规定了适用范围"));
    List<OutlineEntry> outline = List.of(new OutlineEntry("第一章 总则", 0));

    HeadingLevels result = strategy.classify(blocks, outline);

    assertThat(result.levels()).containsExactly(0);
  }

  @Test
  @DisplayName("should compute pivot as max outline level minus one")
  void shouldComputePivotFromDeepestOutlineLevel() {
    List<OutlineEntry> outline =
        List.of(
            new OutlineEntry("Part", 0), new OutlineEntry("Chapter", 1), new OutlineEntry("Sub", 2));

    HeadingLevels result = strategy.classify(List.of(block("unrelated")), outline);

    assertThat(result.pivotLevel()).isEqualTo(1);
    assertThat(result.levels()).containsExactly(3);
  }

  @Test
  @DisplayName("should report zero similarity for empty bigram sets")
  void shouldHandleEmptyBigramSets() {
    assertThat(OutlineMatchingStrategy.similarity(Set.of(), Set.of())).isZero();
    assertThat(OutlineMatchingStrategy.bigrams("a".codePoints().toArray(), 1)).isEmpty();
  }

  @Test
  @DisplayName("should divide the overlap by the larger bigram set")
  void shouldDivideOverlapByLargerSet() {
    double similarity =
        OutlineMatchingStrategy.similarity(Set.of("ab", "bc"), Set.of("ab", "bc", "cd", "de"));

    assertThat(similarity).isEqualTo(0.5);
  }
}
