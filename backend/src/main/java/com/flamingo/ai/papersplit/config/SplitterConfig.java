package com.flamingo.ai.papersplit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for paper analysis and splitting. */
@Configuration
@ConfigurationProperties(prefix = "splitter")
@Getter
@Setter
public class SplitterConfig {

  private Header header = new Header();
  private Storage storage = new Storage();

  /** Geometry used to decide which text on a page counts as its header. */
  @Getter
  @Setter
  public static class Header {
    /** Fraction of the page height, measured from the top, that forms the header band. */
    private float regionRatio = 0.20f;

    /** Maximum baseline difference (PDF units) for two words to sit on the same line. */
    private float lineTolerance = 2.0f;

    /**
     * Maximum gap between two lines, as a multiple of the upper line's height, for them to belong
     * to the same text block.
     */
    private float blockGapRatio = 1.0f;
  }

  /** Local filesystem layout for source documents, analysis artifacts and split output. */
  @Getter
  @Setter
  public static class Storage {
    /** Root directory for everything the service reads and writes. */
    private String basePath = "data";

    private String sourceDir = "source";
    private String outputDir = "output";

    /** File name of the persisted analysis, stored next to the document's split output. */
    private String analysisFileName = "analysis.json";
  }
}
