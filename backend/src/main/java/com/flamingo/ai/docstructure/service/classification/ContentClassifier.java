package com.flamingo.ai.docstructure.service.classification;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.CatalogEntryPayload;
import com.flamingo.ai.docstructure.service.layout.model.ElementKind;
import com.flamingo.ai.docstructure.service.layout.model.LayoutElement;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Labels text units by content category with ordered lexical checks and extracts catalog fields.
 *
 * <p>Checks run in a fixed order (index, sustainability, technical, moodboard, catalog entry) and
 * the first match wins. Only catalog entries whose quality score clears the configured floor are
 * retained for association.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentClassifier {

  private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");
  private static final Pattern ANY_DIGIT = Pattern.compile("\\d");
  private static final Pattern DOTTED_LEADER = Pattern.compile("\\.{3,}");
  private static final Pattern CROSS_DIMENSION = Pattern.compile("\\d+\\s*[×x]\\s*\\d+");
  private static final Pattern MM_DIMENSION = Pattern.compile("\\d+\\s*mm");
  private static final Pattern ATTRIBUTION_CUE =
      Pattern.compile(
          "by\\s+[A-Z][a-z]+|BY\\s+[A-Z]+|designed\\s+by|studio|estudi", Pattern.CASE_INSENSITIVE);

  private static final Pattern DESCRIPTION_CUE =
      Pattern.compile("material|texture|finish|color|collection", Pattern.CASE_INSENSITIVE);

  private static final List<String> INDEX_CUES = List.of("table of contents", "index", "contents");

  private static final List<String> SUSTAINABILITY_CUES =
      List.of(
          "sustainability",
          "certification",
          "environmental",
          "eco-friendly",
          "carbon footprint",
          "recycled",
          "leed",
          "greenguard");

  private static final List<String> TECHNICAL_CUES =
      List.of(
          "technical characteristics",
          "specifications",
          "technical data",
          "properties",
          "weight per",
          "fire rating");

  private static final List<String> MOODBOARD_CUES =
      List.of("moodboard", "mood board", "inspiration", "collection overview");

  private final StructureConfig structureConfig;
  private final PayloadExtractor payloadExtractor;

  /**
   * Produces one text unit per text-bearing element, in document order. Images are skipped.
   *
   * @param layout the layout model
   * @return text units
   */
  public List<TextUnit> toTextUnits(LayoutModel layout) {
    List<TextUnit> units = new ArrayList<>();
    for (LayoutElement element : layout.elements()) {
      if (element.kind() != ElementKind.IMAGE && element.hasText()) {
        units.add(toTextUnit(element));
      }
    }
    return units;
  }

  /**
   * Normalizes one element's text: whitespace runs inside a line collapse to one space and a
   * block element ends with a line break.
   */
  public TextUnit toTextUnit(LayoutElement element) {
    StringBuilder sb = new StringBuilder();
    for (String line : element.text().split("\n")) {
      String normalized = INLINE_WHITESPACE.matcher(line).replaceAll(" ").trim();
      if (normalized.isEmpty()) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(normalized);
    }
    if (element.kind() != ElementKind.CONTAINER && sb.length() > 0) {
      sb.append('\n');
    }
    return new TextUnit(
        "unit_" + element.id(),
        element.id(),
        sb.toString(),
        element.pageNumber(),
        element.boundingBox(),
        element.isHeading(),
        null);
  }

  /**
   * Decides the content category of a text span. First matching check wins.
   *
   * @param text the text to classify
   * @return the category, {@link ContentCategory#UNKNOWN} when nothing matches
   */
  public ContentCategory categorize(String text) {
    String lower = text.toLowerCase(Locale.ROOT);

    if (containsAny(lower, INDEX_CUES)
        || (lower.contains("page") && ANY_DIGIT.matcher(lower).find())
        || DOTTED_LEADER.matcher(lower).find()) {
      return ContentCategory.INDEX;
    }
    if (containsAny(lower, SUSTAINABILITY_CUES)) {
      return ContentCategory.SUSTAINABILITY;
    }
    if (containsAny(lower, TECHNICAL_CUES)
        || (lower.contains("mm") && lower.contains("thickness"))) {
      return ContentCategory.TECHNICAL_SPEC;
    }
    if (containsAny(lower, MOODBOARD_CUES)
        || (lower.contains("contrast") && !PayloadExtractor.UPPERCASE_RUN.matcher(text).find())) {
      return ContentCategory.MOODBOARD;
    }
    if (PayloadExtractor.UPPERCASE_RUN.matcher(text).find()
        && (CROSS_DIMENSION.matcher(text).find() || MM_DIMENSION.matcher(text).find())) {
      return ContentCategory.CATALOG_ENTRY;
    }
    return ContentCategory.UNKNOWN;
  }

  /**
   * Classifies one unit.
   *
   * @param unit the text unit
   * @return the candidate, or empty when the unit is shorter than the minimum length
   */
  public Optional<EntityCandidate> classify(TextUnit unit) {
    String text = unit.text().trim();
    if (text.length() < structureConfig.getClassification().getMinTextLength()) {
      return Optional.empty();
    }

    ContentCategory category = categorize(text);
    ContentPayload payload = payloadExtractor.extract(category, text);
    double quality =
        payload instanceof CatalogEntryPayload catalog ? qualityScore(catalog, text.length()) : 0.0;

    return Optional.of(
        new EntityCandidate(
            "entity_" + unit.id(),
            unit.id(),
            category,
            patternConfidence(text),
            quality,
            payload,
            unit.pageNumber(),
            unit.boundingBox(),
            text,
            unit.embedding()));
  }

  /**
   * Classifies every unit and keeps the catalog entries that clear the quality floor.
   *
   * @param units text units in document order
   * @return retained candidates in document order
   */
  public List<EntityCandidate> classifyAll(List<TextUnit> units) {
    double floor = structureConfig.getClassification().getQualityFloor();
    List<EntityCandidate> retained = new ArrayList<>();
    int classified = 0;
    for (TextUnit unit : units) {
      Optional<EntityCandidate> candidate = classify(unit);
      if (candidate.isEmpty()) {
        continue;
      }
      classified++;
      EntityCandidate entity = candidate.get();
      if (entity.category() == ContentCategory.CATALOG_ENTRY && entity.qualityScore() > floor) {
        retained.add(entity);
      } else {
        log.debug(
            "Discarding unit {}: category={}, quality={}",
            unit.id(),
            entity.category(),
            entity.qualityScore());
      }
    }
    log.debug(
        "Classified {} of {} units, retained {} catalog entries",
        classified,
        units.size(),
        retained.size());
    return retained;
  }

  /**
   * Weighted sum over the present catalog fields, halved for short text, clamped to [0, 1].
   *
   * @param payload extracted catalog fields
   * @param textLength length of the source text
   * @return quality score
   */
  public double qualityScore(CatalogEntryPayload payload, int textLength) {
    double score = 0.0;
    if (payload.hasName()) {
      score += 0.3;
    }
    if (payload.hasDimensions()) {
      score += 0.25;
    }
    if (payload.hasAttribution()) {
      score += 0.2;
    }
    if (payload.hasDescription()) {
      score += 0.15;
    }
    if (!payload.colors().isEmpty()) {
      score += 0.05;
    }
    if (!payload.materials().isEmpty()) {
      score += 0.05;
    }
    if (textLength < structureConfig.getClassification().getShortTextLength()) {
      score *= 0.5;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  private double patternConfidence(String text) {
    double confidence = 0.0;
    if (PayloadExtractor.UPPERCASE_RUN.matcher(text).find()) {
      confidence += 0.4;
    }
    if (PayloadExtractor.DIMENSION.matcher(text).find()) {
      confidence += 0.3;
    }
    if (ATTRIBUTION_CUE.matcher(text).find()) {
      confidence += 0.2;
    }
    if (text.length() > 100 && DESCRIPTION_CUE.matcher(text).find()) {
      confidence += 0.1;
    }
    return Math.min(1.0, confidence);
  }

  private static boolean containsAny(String lower, List<String> cues) {
    for (String cue : cues) {
      if (lower.contains(cue)) {
        return true;
      }
    }
    return false;
  }
}
