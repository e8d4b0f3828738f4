package com.flamingo.ai.docstructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for structure reconstruction and chunk merging. */
@Configuration
@ConfigurationProperties(prefix = "structure")
@Getter
@Setter
public class StructureConfig {

  private Merge merge = new Merge();
  private Outline outline = new Outline();
  private Vision vision = new Vision();
  private Tokenizer tokenizer = new Tokenizer();
  private Defaults defaults = new Defaults();

  /**
   * Token thresholds of the greedy chunk merger.
   *
   * <p>The defaults are compatibility constants; they have no derivation beyond matching the
   * chunk sizes existing indexes were built with.
   */
  @Getter
  @Setter
  public static class Merge {
    /** Below this running count an item is always merged into the open chunk. */
    private int minTokens = 32;

    /** Below this running count items of the same section (or tables) are merged. */
    private int maxTokens = 1024;
  }

  @Getter
  @Setter
  public static class Outline {
    /** Outline entries per block above which the outline is trusted for heading levels. */
    private double minDensity = 0.03;

    /** Bigram overlap a block needs with an outline entry to take its level. */
    private double similarityThreshold = 0.8;
  }

  @Getter
  @Setter
  public static class Vision {
    /** Resolution used when rendering PDF pages for the vision model. */
    private float dpi = 150f;

    private int timeoutSeconds = 120;

    /** Prompt sent along with every rendered page or embedded image. */
    private String prompt =
        """
        Please extract the layout information from the image and output only the text content \
        in Markdown format.

        1. Ignore bounding boxes and coordinates.
        2. Categories:
           - Picture: omit the text field.
           - Formula: output as LaTeX format (enclosed in $ or $$).
           - Table: MUST output as HTML table format with <table>, <tr>, <td>, <th> tags. \
        Preserve all data and structure.
           - All other categories (Text, Title, Caption, etc.): output as Markdown.

        3. Constraints:
           - The output text must be the original text from the image, with no translation.
           - All layout elements must be sorted according to human reading order.
           - Tables should be formatted as complete HTML tables without unnecessary spaces or \
        newlines.

        4. Final Output: A single Markdown document containing the extracted content with tables \
        in HTML format.""";
  }

  @Getter
  @Setter
  public static class Tokenizer {
    /** OpenAI model whose encoding is used to count tokens (cl100k_base by default). */
    private String modelName = "gpt-3.5-turbo";
  }

  /** Parser configuration applied when a request leaves an option unset. */
  @Getter
  @Setter
  public static class Defaults {
    private int chunkTokenNum = 512;
    private String delimiter = "\n!?。；！？";
    private String layoutRecognize = "DeepDOC";
    private int fromPage = 0;
    private int toPage = 100000;
    private String language = "Chinese";
  }
}
