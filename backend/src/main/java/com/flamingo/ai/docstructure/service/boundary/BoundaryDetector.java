package com.flamingo.ai.docstructure.service.boundary;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.classification.TextUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores the logical break after each text unit.
 *
 * <p>Strength is an additive score over lexical cues at the end of the unit. Similarity to the
 * successor comes from embeddings when both units carry one, otherwise from a length and
 * first-token heuristic. A strong break followed by dissimilar text is flagged as an entity
 * boundary.
 *
 * <p>The pass is sequential: each score depends on the unit and its successor only, in order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BoundaryDetector {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*\\z");
  private static final Pattern CLAUSE_END = Pattern.compile("[,;:]\\s*\\z");
  private static final Pattern TRAILING_BREAK = Pattern.compile("\\n\\s*\\z");
  private static final Pattern BARE_WORD_END = Pattern.compile("\\w\\z");
  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#+\\s+");
  private static final Pattern CAPS_LINE = Pattern.compile("^[A-Z][A-Z\\s]+$");

  // Scores are kept in hundredths so the additive rules stay exact
  private static final int BASE = 30;
  private static final int SENTENCE_BONUS = 40;
  private static final int CLAUSE_BONUS = 15;
  private static final int BREAK_BONUS = 20;
  private static final int HEADING_BONUS = 15;
  private static final int BARE_WORD_PENALTY = 15;

  private static final double WEAK_STRENGTH = 0.3;

  private final StructureConfig structureConfig;

  /**
   * Scores every adjacent pair of units, in order.
   *
   * @param units text units in document order
   * @return one score per unit except the last
   */
  public List<BoundaryScore> detect(List<TextUnit> units) {
    List<BoundaryScore> scores = new ArrayList<>();
    if (units == null || units.size() < 2) {
      return scores;
    }
    int entityBoundaries = 0;
    for (int i = 0; i < units.size() - 1; i++) {
      BoundaryScore score = score(units.get(i), units.get(i + 1));
      if (score.entityBoundary()) {
        entityBoundaries++;
      }
      scores.add(score);
    }
    log.debug(
        "Scored {} boundaries over {} units, {} entity boundaries",
        scores.size(),
        units.size(),
        entityBoundaries);
    return scores;
  }

  /**
   * Scores the break between a unit and its successor.
   *
   * @param unit the unit
   * @param next its successor
   * @return the boundary score
   */
  public BoundaryScore score(TextUnit unit, TextUnit next) {
    StructureConfig.Boundary config = structureConfig.getBoundary();
    String text = unit.text();
    boolean headingCue = unit.heading() || endsWithHeadingLine(text);

    double strength = strength(text, unit.heading());

    SimilaritySource source;
    double similarity;
    if (unit.hasEmbedding() && next.hasEmbedding()) {
      similarity = VectorSimilarity.cosine(unit.embedding(), next.embedding());
      source = SimilaritySource.EMBEDDING;
    } else {
      similarity = heuristicSimilarity(text, next.text());
      source = SimilaritySource.HEURISTIC;
    }

    BoundaryType type;
    if (strength < WEAK_STRENGTH) {
      type = BoundaryType.WEAK;
    } else if (headingCue) {
      type = BoundaryType.SECTION;
    } else if (TRAILING_BREAK.matcher(text).find()) {
      type = BoundaryType.PARAGRAPH;
    } else if (SENTENCE_END.matcher(text).find()) {
      type = BoundaryType.SENTENCE;
    } else if (similarity < config.getSemanticTypeThreshold()) {
      type = BoundaryType.SEMANTIC;
    } else {
      type = BoundaryType.WEAK;
    }

    boolean entityBoundary =
        strength > config.getEntityStrengthThreshold()
            && similarity < config.getEntitySimilarityThreshold();

    return new BoundaryScore(
        unit.id(),
        next.id(),
        strength,
        type,
        similarity,
        source,
        entityBoundary,
        reasoning(strength, type, similarity, source));
  }

  /**
   * Additive break strength over the cues at the end of the text, clamped to [0, 1]. Blank text
   * has strength 0.
   *
   * @param text unit text
   * @param fromHeading whether the unit came from a heading element
   * @return strength
   */
  public double strength(String text, boolean fromHeading) {
    String trimmed = text == null ? "" : text.trim();
    if (trimmed.isEmpty()) {
      return 0.0;
    }
    int hundredths = BASE;
    if (SENTENCE_END.matcher(trimmed).find()) {
      hundredths += SENTENCE_BONUS;
    } else if (CLAUSE_END.matcher(trimmed).find()) {
      hundredths += CLAUSE_BONUS;
    }
    // the break cue is the only one read from the untrimmed text
    if (TRAILING_BREAK.matcher(text).find()) {
      hundredths += BREAK_BONUS;
    }
    if (fromHeading || endsWithHeadingLine(trimmed)) {
      hundredths += HEADING_BONUS;
    }
    if (BARE_WORD_END.matcher(trimmed).find()) {
      hundredths -= BARE_WORD_PENALTY;
    }
    return Math.max(0, Math.min(100, hundredths)) / 100.0;
  }

  /**
   * Similarity estimate in [0, 1] for units without embeddings: half length ratio, half whether
   * the first tokens match.
   */
  public double heuristicSimilarity(String a, String b) {
    String left = a == null ? "" : a.trim();
    String right = b == null ? "" : b.trim();
    int longer = Math.max(left.length(), right.length());
    double lengthRatio =
        longer == 0 ? 0.0 : (double) Math.min(left.length(), right.length()) / longer;
    String firstLeft = firstToken(left);
    double tokenMatch = !firstLeft.isEmpty() && firstLeft.equals(firstToken(right)) ? 1.0 : 0.0;
    return 0.5 * lengthRatio + 0.5 * tokenMatch;
  }

  private boolean endsWithHeadingLine(String text) {
    String[] lines = text.split("\n");
    for (int i = lines.length - 1; i >= 0; i--) {
      String line = lines[i].trim();
      if (!line.isEmpty()) {
        return MARKDOWN_HEADING.matcher(line).find() || CAPS_LINE.matcher(line).matches();
      }
    }
    return false;
  }

  private static String firstToken(String text) {
    if (text.isEmpty()) {
      return "";
    }
    return text.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
  }

  private static String reasoning(
      double strength, BoundaryType type, double similarity, SimilaritySource source) {
    List<String> parts = new ArrayList<>();
    if (strength > 0.7) {
      parts.add("strong boundary marker");
    } else if (strength > 0.4) {
      parts.add("moderate boundary marker");
    } else {
      parts.add("weak boundary marker");
    }
    parts.add(type.name().toLowerCase(Locale.ROOT) + " break");
    if (similarity < 0.5) {
      parts.add("low semantic similarity");
    } else if (similarity > 0.8) {
      parts.add("high semantic similarity");
    }
    if (source == SimilaritySource.HEURISTIC) {
      parts.add("heuristic similarity");
    }
    return String.join(", ", parts);
  }
}
