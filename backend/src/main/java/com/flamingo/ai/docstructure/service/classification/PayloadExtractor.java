package com.flamingo.ai.docstructure.service.classification;

import com.flamingo.ai.docstructure.service.classification.ContentPayload.CatalogEntryPayload;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.IndexPayload;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.MoodboardPayload;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.SustainabilityPayload;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.TechnicalSpecPayload;
import com.flamingo.ai.docstructure.service.classification.ContentPayload.UnclassifiedPayload;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts the category-specific payload from classified text. Stateless. */
@Component
public class PayloadExtractor {

  static final Pattern UPPERCASE_RUN = Pattern.compile("[A-Z]{2,}");
  static final Pattern PRODUCT_NAME = Pattern.compile("\\b[A-Z]{2,}(?:\\s+[A-Z]{2,})*\\b");
  static final Pattern DIMENSION = Pattern.compile("\\d+\\s*[×x]\\s*\\d+|\\d+\\s*mm|\\d+\\s*cm");

  private static final String NAME_TOKEN = "\\p{Lu}[\\p{L}'&.-]*";

  private static final Pattern BY_ATTRIBUTION =
      Pattern.compile(
          "\\b(?i:designed\\s+by|by)[ \\t]+(" + NAME_TOKEN + "(?:[ \\t]+" + NAME_TOKEN + ")*)");

  private static final Pattern STUDIO_ATTRIBUTION =
      Pattern.compile("\\b((?i:studio|estudi)(?:[ \\t]+" + NAME_TOKEN + ")*)");

  private static final Pattern COLOR =
      Pattern.compile(
          "\\b(?:white|black|grey|gray|beige|taupe|sand|clay|anthracite|cream|ivory|brown|blue"
              + "|green|red|yellow|orange|purple|pink)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern MATERIAL =
      Pattern.compile(
          "\\b(?:ceramic|porcelain|stone|marble|granite|wood|metal|glass|concrete|tile|vinyl"
              + "|laminate)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern DESCRIPTION_CUE =
      Pattern.compile("material|texture|finish|color|collection", Pattern.CASE_INSENSITIVE);

  private static final Pattern PAGE_REFERENCE =
      Pattern.compile("(?:\\bpage\\s+|\\.{3,}\\s*)(\\d{1,6})(?!\\d)", Pattern.CASE_INSENSITIVE);

  private static final Pattern CERTIFICATION_CODE =
      Pattern.compile("\\b(?:ISO|CE|EN|ASTM|ANSI)\\s*\\d+");

  private static final List<String> CERTIFICATION_NAMES =
      List.of("LEED", "Greenguard", "FSC", "EPD", "BREEAM", "Cradle to Cradle");

  private static final Pattern MEASUREMENT =
      Pattern.compile("\\d+(?:[.,]\\d+)?\\s*(?:mm|cm|kg|°C|°F|%|m|g)(?![\\p{L}])");

  private static final Pattern THEME =
      Pattern.compile("(?:theme|concept|style)[:\\s]+([^.!?\\n]+)", Pattern.CASE_INSENSITIVE);

  /** Minimum length for a catalog text to count as a product description. */
  private static final int DESCRIPTION_MIN_LENGTH = 100;

  /**
   * Builds the payload for the given category.
   *
   * @param category category decided by the classifier
   * @param text unit text
   * @return the matching payload variant
   */
  public ContentPayload extract(ContentCategory category, String text) {
    return switch (category) {
      case CATALOG_ENTRY -> extractCatalogEntry(text);
      case INDEX -> new IndexPayload(pageReferences(text));
      case SUSTAINABILITY -> new SustainabilityPayload(certifications(text));
      case TECHNICAL_SPEC -> new TechnicalSpecPayload(allMatches(MEASUREMENT, text, 0));
      case MOODBOARD -> new MoodboardPayload(themes(text));
      case UNKNOWN -> new UnclassifiedPayload();
    };
  }

  public CatalogEntryPayload extractCatalogEntry(String text) {
    Matcher nameMatcher = PRODUCT_NAME.matcher(text);
    String name = nameMatcher.find() ? nameMatcher.group() : null;

    return new CatalogEntryPayload(
        name,
        allMatches(DIMENSION, text, 0),
        attribution(text),
        vocabularyMatches(COLOR, text),
        vocabularyMatches(MATERIAL, text),
        text.length() > DESCRIPTION_MIN_LENGTH && DESCRIPTION_CUE.matcher(text).find());
  }

  private String attribution(String text) {
    Matcher by = BY_ATTRIBUTION.matcher(text);
    if (by.find()) {
      return by.group(1).trim();
    }
    Matcher studio = STUDIO_ATTRIBUTION.matcher(text);
    if (studio.find()) {
      return studio.group(1).trim();
    }
    return null;
  }

  private List<Integer> pageReferences(String text) {
    List<Integer> pages = new ArrayList<>();
    Matcher matcher = PAGE_REFERENCE.matcher(text);
    while (matcher.find()) {
      pages.add(Integer.parseInt(matcher.group(1)));
    }
    return pages;
  }

  private List<String> certifications(String text) {
    Set<String> found = new LinkedHashSet<>();
    String lower = text.toLowerCase(Locale.ROOT);
    for (String name : CERTIFICATION_NAMES) {
      if (lower.contains(name.toLowerCase(Locale.ROOT))) {
        found.add(name);
      }
    }
    found.addAll(allMatches(CERTIFICATION_CODE, text, 0));
    return new ArrayList<>(found);
  }

  private List<String> themes(String text) {
    return allMatches(THEME, text, 1).stream().map(String::trim).toList();
  }

  private static List<String> allMatches(Pattern pattern, String text, int group) {
    List<String> matches = new ArrayList<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      matches.add(matcher.group(group));
    }
    return matches;
  }

  private static Set<String> vocabularyMatches(Pattern pattern, String text) {
    Set<String> matches = new LinkedHashSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      matches.add(matcher.group().toLowerCase(Locale.ROOT));
    }
    return matches;
  }
}
