package com.flamingo.ai.docstructure.service.association;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.boundary.VectorSimilarity;
import com.flamingo.ai.docstructure.service.layout.model.ImageAsset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Links images to the entities or chunks they illustrate.
 *
 * <p>Every image/target pair is scored on three factors:
 *
 * <ul>
 *   <li>spatial: page distance between image and target
 *   <li>lexical: Jaccard overlap of caption/alt words with the target text, boosted when the target
 *       name appears in the caption
 *   <li>visual: cosine similarity of the two embeddings, falling back to the lexical score, then to
 *       a neutral 0.5
 * </ul>
 *
 * <p>Pairs under the overall threshold (or an enabled per-factor minimum) are dropped; the rest are
 * ranked by overall score with id tie-breaks and handed to the {@link AssignmentStrategy}, which
 * enforces the per-image and per-target fan-out caps.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CrossModalAssociationEngine {

  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final int MIN_TOKEN_LENGTH = 3;
  private static final double NAME_BOOST = 0.3;
  private static final double NEUTRAL_VISUAL = 0.5;
  private static final double CONSISTENCY_CEILING = 0.3;

  private static final Comparator<Association> RANKING =
      Comparator.comparingDouble(Association::overallScore)
          .reversed()
          .thenComparing(Association::imageId)
          .thenComparing(Association::targetId);

  private final StructureConfig structureConfig;
  private final AssignmentStrategy assignmentStrategy;

  /**
   * Scores every image against every target and resolves the bounded association set.
   *
   * @param images images of one document
   * @param targets entity candidates or chunks of the same document
   * @return the report; empty when either side is empty
   */
  public AssociationReport associate(
      List<ImageAsset> images, List<? extends AssociationTarget> targets) {
    if (images == null || images.isEmpty() || targets == null || targets.isEmpty()) {
      return AssociationReport.empty();
    }
    StructureConfig.Association config = structureConfig.getAssociation();

    List<Association> accepted = new ArrayList<>();
    int evaluated = 0;
    for (ImageAsset image : images) {
      for (AssociationTarget target : targets) {
        Association association;
        try {
          association = score(image, target);
        } catch (RuntimeException e) {
          log.warn(
              "Skipping pair image={} target={}: {}",
              image.id(),
              target.targetId(),
              e.getMessage());
          continue;
        }
        evaluated++;
        if (accepts(association, config)) {
          accepted.add(association);
        }
      }
    }

    accepted.sort(RANKING);
    List<Association> assigned =
        assignmentStrategy.assign(accepted, config.getMaxPerImage(), config.getMaxPerTarget());

    double averageConfidence =
        assigned.stream().mapToDouble(Association::confidence).average().orElse(0.0);

    log.debug(
        "Evaluated {} pairs ({} images x {} targets), {} above threshold, {} assigned",
        evaluated,
        images.size(),
        targets.size(),
        accepted.size(),
        assigned.size());

    return new AssociationReport(
        assigned, evaluated, averageConfidence, AssociationReport.bandCounts(assigned));
  }

  /**
   * Scores one pair with the configured weights.
   *
   * @param image the image
   * @param target the entity or chunk
   * @return the scored association, not yet filtered
   */
  public Association score(ImageAsset image, AssociationTarget target) {
    StructureConfig.Association.Weights weights = structureConfig.getAssociation().getWeights();

    int pageDifference = Math.abs(image.pageNumber() - target.pageNumber());
    String imageText = image.descriptiveText();
    String targetText = targetText(target);

    double spatial = spatialScore(pageDifference);
    double lexical = lexicalScore(imageText, targetText, target.name());
    double visual = visualScore(image, target, imageText, targetText);

    double overall =
        spatial * weights.getSpatial()
            + lexical * weights.getLexical()
            + visual * weights.getVisual();
    double agreement = Math.max(0.0, CONSISTENCY_CEILING - variance(spatial, lexical, visual));
    double confidence = Math.min(1.0, overall + agreement);

    return new Association(
        image.id(),
        target.targetId(),
        target.targetKind(),
        spatial,
        lexical,
        visual,
        overall,
        confidence,
        reasoning(spatial, lexical, visual, overall),
        pageDifference);
  }

  /** 1.0 on the same page, decaying with page distance, never below 0.1. */
  public double spatialScore(int pageDifference) {
    if (pageDifference == 0) {
      return 1.0;
    }
    if (pageDifference == 1) {
      return 0.8;
    }
    if (pageDifference <= 2) {
      return 0.6;
    }
    if (pageDifference <= 3) {
      return 0.4;
    }
    return Math.max(0.1, 1.0 / (pageDifference * 0.5));
  }

  /**
   * Jaccard similarity of the word sets (words of three or more characters), plus 0.3 when the
   * target name appears in the image text. Capped at 1.
   */
  public double lexicalScore(String imageText, String targetText, String targetName) {
    if (imageText == null || imageText.isBlank() || targetText == null || targetText.isBlank()) {
      return 0.0;
    }
    Set<String> imageWords = tokens(imageText);
    Set<String> targetWords = tokens(targetText);
    if (imageWords.isEmpty() || targetWords.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(imageWords);
    intersection.retainAll(targetWords);
    Set<String> union = new HashSet<>(imageWords);
    union.addAll(targetWords);
    double jaccard = (double) intersection.size() / union.size();

    if (targetName != null
        && !targetName.isBlank()
        && imageText.toLowerCase(Locale.ROOT).contains(targetName.toLowerCase(Locale.ROOT))) {
      return Math.min(1.0, jaccard + NAME_BOOST);
    }
    return jaccard;
  }

  private double visualScore(
      ImageAsset image, AssociationTarget target, String imageText, String targetText) {
    float[] targetEmbedding = target.embedding();
    if (image.hasEmbedding() && targetEmbedding != null && targetEmbedding.length > 0) {
      double cosine = VectorSimilarity.cosine(image.embedding(), targetEmbedding);
      return Math.max(0.0, Math.min(1.0, cosine));
    }
    if (!imageText.isBlank() && !targetText.isBlank()) {
      return lexicalScore(imageText, targetText, null);
    }
    return NEUTRAL_VISUAL;
  }

  private boolean accepts(Association association, StructureConfig.Association config) {
    return association.overallScore() >= config.getOverallThreshold()
        && association.spatialScore() >= config.getMinSpatialScore()
        && association.lexicalScore() >= config.getMinLexicalScore()
        && association.visualScore() >= config.getMinVisualScore();
  }

  private static String targetText(AssociationTarget target) {
    String description = target.description();
    if (description != null && !description.isBlank()) {
      return description;
    }
    return target.name() == null ? "" : target.name();
  }

  private static Set<String> tokens(String text) {
    Set<String> words = new HashSet<>();
    for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (token.length() >= MIN_TOKEN_LENGTH) {
        words.add(token);
      }
    }
    return words;
  }

  /** Population variance. */
  static double variance(double... scores) {
    double mean = 0.0;
    for (double score : scores) {
      mean += score;
    }
    mean /= scores.length;
    double sum = 0.0;
    for (double score : scores) {
      sum += (score - mean) * (score - mean);
    }
    return sum / scores.length;
  }

  static String reasoning(double spatial, double lexical, double visual, double overall) {
    List<String> reasons = new ArrayList<>();
    if (spatial >= 0.8) {
      reasons.add("same/adjacent page");
    } else if (spatial >= 0.6) {
      reasons.add("nearby pages");
    } else if (spatial >= 0.4) {
      reasons.add("moderate spatial proximity");
    }

    if (lexical >= 0.7) {
      reasons.add("strong text similarity");
    } else if (lexical >= 0.5) {
      reasons.add("moderate text similarity");
    } else if (lexical >= 0.3) {
      reasons.add("some text overlap");
    }

    if (visual >= 0.7) {
      reasons.add("high visual-text similarity");
    } else if (visual >= 0.5) {
      reasons.add("moderate visual relevance");
    }

    String assessment =
        switch (ScoreBand.of(overall)) {
          case HIGH -> "Strong association";
          case GOOD -> "Good association";
          case MODERATE -> "Moderate association";
          case LOW -> "Weak association";
        };
    return reasons.isEmpty() ? assessment : assessment + " (" + String.join(", ", reasons) + ")";
  }
}
