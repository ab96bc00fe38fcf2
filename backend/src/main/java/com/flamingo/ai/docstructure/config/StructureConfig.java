package com.flamingo.ai.docstructure.config;

import com.flamingo.ai.docstructure.service.association.TargetMode;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document structure pipeline. */
@Configuration
@ConfigurationProperties(prefix = "structure")
@Getter
@Setter
public class StructureConfig {

  private Layout layout = new Layout();
  private Classification classification = new Classification();
  private Boundary boundary = new Boundary();
  private Chunking chunking = new Chunking();
  private Association association = new Association();
  private Embedding embedding = new Embedding();

  /** Element confidence adjustments applied by the layout model builder. */
  @Getter
  @Setter
  public static class Layout {
    private double baseConfidence = 0.8;

    /** Bonus for an explicit {@code data-type} attribute. */
    private double typeBonus = 0.1;

    /** Bonus for explicit {@code data-bbox} position metadata. */
    private double positionBonus = 0.05;

    private double layoutClassBonus = 0.05;

    /** Penalty for a {@code div} with no class. */
    private double genericPenalty = 0.2;

    private double minConfidence = 0.5;
    private double maxConfidence = 1.0;
  }

  @Getter
  @Setter
  public static class Classification {
    /** Units shorter than this are never classified. */
    private int minTextLength = 50;

    /** Below this length the quality score is halved. */
    private int shortTextLength = 100;

    /** Catalog entries must score strictly above this to be retained for association. */
    private double qualityFloor = 0.5;
  }

  @Getter
  @Setter
  public static class Boundary {
    /** Strength must exceed this for an entity boundary. */
    private double entityStrengthThreshold = 0.6;

    /** Similarity must stay below this for an entity boundary. */
    private double entitySimilarityThreshold = 0.6;

    /** Similarity below which an otherwise unremarkable break is typed as semantic. */
    private double semanticTypeThreshold = 0.5;

    private boolean clusteringEnabled = false;

    /** Number of clusters; 0 derives it from the unit count. */
    private int clusterCount = 0;

    private int maxClusterIterations = 20;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int targetSize = 1000;
    private int minSize = 300;
    private int maxSize = 2000;
    private int overlap = 200;
    private boolean respectHierarchy = true;

    /** Start a new chunk after a text unit flagged as an entity boundary. */
    private boolean splitOnEntityBoundary = true;

    /**
     * Checks that the sizes can be satisfied together.
     *
     * @throws IllegalArgumentException if the sizes are inconsistent
     */
    public void validate() {
      if (minSize < 0 || minSize > targetSize || targetSize > maxSize) {
        throw new IllegalArgumentException(
            String.format(
                "Chunk sizes must satisfy 0 <= min <= target <= max, got min=%d target=%d max=%d",
                minSize, targetSize, maxSize));
      }
      if (overlap < 0 || overlap + 2 >= maxSize - minSize) {
        throw new IllegalArgumentException(
            String.format(
                "Overlap %d leaves no room between min=%d and max=%d", overlap, minSize, maxSize));
      }
    }
  }

  /** Configuration for the cross-modal association engine. */
  @Getter
  @Setter
  public static class Association {
    private Weights weights = new Weights();

    /** Per-factor minimums; 0 disables the gate. */
    private double minSpatialScore = 0.0;

    private double minLexicalScore = 0.0;
    private double minVisualScore = 0.0;

    /** Minimum overall score to keep a pair. */
    private double overallThreshold = 0.6;

    private int maxPerImage = 3;
    private int maxPerTarget = 5;

    private TargetMode targetMode = TargetMode.AUTO;

    @Getter
    @Setter
    public static class Weights {
      private double spatial = 0.4;
      private double lexical = 0.3;
      private double visual = 0.3;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    private boolean enabled = true;

    /** Text longer than this is truncated before it is sent to the model. */
    private int maxChars = 5000;

    private Duration cacheTtl = Duration.ofHours(24);
  }
}
