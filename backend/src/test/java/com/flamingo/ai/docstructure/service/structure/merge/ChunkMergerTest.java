package com.flamingo.ai.docstructure.service.structure.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.structure.model.Position;
import com.flamingo.ai.docstructure.service.structure.model.SectionedItem;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkMerger Tests")
class ChunkMergerTest {

  /** One token per character keeps the thresholds easy to reason about. */
  private final TokenCounter characterCounter = String::length;

  private ChunkMerger merger;

  @BeforeEach
  void setUp() {
    merger = new ChunkMerger(characterCounter, new StructureConfig());
  }

  private static SectionedItem item(String text, int sectionId) {
    return new SectionedItem(text, sectionId, List.of(Position.NONE));
  }

  @Nested
  @DisplayName("thresholds")
  class Thresholds {

    @Test
    @DisplayName("should merge anything while the chunk is below 32 tokens")
    void shouldMergeBelowMinTokens() {
      List<String> chunks =
          merger.merge(List.of(item("a".repeat(31), 1), item("b", 2), item("c", 3)));

      assertThat(chunks).containsExactly("a".repeat(31) + "\nb", "c");
    }

    @Test
    @DisplayName("should treat 32 tokens as no longer tiny")
    void shouldNotMergeAtExactlyMinTokens() {
      List<String> chunks = merger.merge(List.of(item("a".repeat(32), 1), item("b", 2)));

      assertThat(chunks).containsExactly("a".repeat(32), "b");
    }

    @Test
    @DisplayName("should still merge an item after a 32 token chunk of the same section")
    void shouldMergeSameSectionAtExactlyMinTokens() {
      String first = "a".repeat(32);
      String second = "b".repeat(32);

      List<String> chunks = merger.merge(List.of(item(first, 1), item(second, 1)));

      assertThat(chunks).containsExactly(first + "\n" + second);
    }

    @Test
    @DisplayName("should merge items of the same section below 1024 tokens")
    void shouldMergeSameSection() {
      String text = "x".repeat(100);

      List<String> chunks = merger.merge(List.of(item(text, 1), item(text, 1), item(text, 1)));

      assertThat(chunks).containsExactly(text + "\n" + text + "\n" + text);
    }

    @Test
    @DisplayName("should close the chunk once it reaches 1024 tokens")
    void shouldSplitAtMaxTokens() {
      String big = "x".repeat(1024);

      List<String> chunks = merger.merge(List.of(item(big, 1), item("tail", 1)));

      assertThat(chunks).containsExactly(big, "tail");
    }
  }

  @Nested
  @DisplayName("sections and tables")
  class SectionsAndTables {

    @Test
    @DisplayName("should append tables to the open chunk without changing its section")
    void shouldTreatTablesAsWildcard() {
      String text = "x".repeat(100);

      List<String> chunks =
          merger.merge(
              List.of(
                  item(text, 1),
                  item("<table></table>", SectionedItem.TABLE_SECTION),
                  item("y".repeat(40), 2)));

      assertThat(chunks).containsExactly(text + "\n<table></table>", "y".repeat(40));
    }

    @Test
    @DisplayName("should take the section of merged items as the current section")
    void shouldTrackSectionOfMergedItems() {
      List<String> chunks =
          merger.merge(
              List.of(
                  item("a".repeat(40), 0),
                  item("b".repeat(5), 1),
                  item("c".repeat(5), 2),
                  item("d".repeat(40), 2),
                  item("e".repeat(5), 2)));

      assertThat(chunks)
          .containsExactly(
              "a".repeat(40),
              "b".repeat(5) + "\n" + "c".repeat(5) + "\n" + "d".repeat(40) + "\n" + "e".repeat(5));
    }
  }

  @Test
  @DisplayName("should sort by page, top and left and append geometry tags")
  void shouldSortIntoReadingOrderWithTags() {
    SectionedItem second =
        new SectionedItem("second", 1, List.of(new Position(2, 10, 20, 30, 40)));
    SectionedItem first = new SectionedItem("first", 1, List.of(new Position(1, 10, 20, 30, 40)));

    List<String> chunks = merger.merge(List.of(second, first));

    assertThat(chunks)
        .containsExactly(
            "first@@1\t10.0\t20.0\t30.0\t40.0##\nsecond@@2\t10.0\t20.0\t30.0\t40.0##");
  }

  @Test
  @DisplayName("should emit one chunk per item when every item is in section 0")
  void shouldNotMerge_whenUnstructured() {
    List<String> chunks = merger.merge(List.of(item("page 1", 0), item("page 2", 0), item("page 3", 0)));

    assertThat(chunks).containsExactly("page 1", "page 2", "page 3");
  }

  @Test
  @DisplayName("should keep chunks as contiguous runs of the sorted items")
  void shouldKeepChunksContiguous() {
    List<SectionedItem> items =
        List.of(item("a".repeat(50), 1), item("b".repeat(50), 2), item("c".repeat(50), 2), item("d", 3));

    List<String> chunks = merger.merge(items);

    assertThat(String.join("\n", chunks))
        .isEqualTo("a".repeat(50) + "\n" + "b".repeat(50) + "\n" + "c".repeat(50) + "\n" + "d");
    assertThat(chunks).hasSize(3);
  }

  @Test
  @DisplayName("should return no chunks for no items")
  void shouldHandleEmpty() {
    assertThat(merger.merge(List.of())).isEmpty();
  }
}
