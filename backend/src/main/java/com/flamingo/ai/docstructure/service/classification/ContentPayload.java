package com.flamingo.ai.docstructure.service.classification;

import java.util.List;
import java.util.Set;

/**
 * Structured extraction result, one variant per {@link ContentCategory}.
 *
 * <p>Each variant carries only the fields its category guarantees, so consumers can switch over
 * the sealed hierarchy exhaustively.
 */
public sealed interface ContentPayload
    permits ContentPayload.CatalogEntryPayload,
        ContentPayload.IndexPayload,
        ContentPayload.SustainabilityPayload,
        ContentPayload.TechnicalSpecPayload,
        ContentPayload.MoodboardPayload,
        ContentPayload.UnclassifiedPayload {

  ContentCategory category();

  /**
   * Fields extracted from a catalog entry.
   *
   * @param name first run of two or more uppercase tokens, or {@code null}
   * @param dimensions dimension matches in text order
   * @param attribution designer or studio attribution, or {@code null}
   * @param colors colors from the fixed vocabulary, lower-case
   * @param materials materials from the fixed vocabulary, lower-case
   * @param hasDescription whether the text reads as a product description
   */
  record CatalogEntryPayload(
      String name,
      List<String> dimensions,
      String attribution,
      Set<String> colors,
      Set<String> materials,
      boolean hasDescription)
      implements ContentPayload {

    public CatalogEntryPayload {
      dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
      colors = colors == null ? Set.of() : Set.copyOf(colors);
      materials = materials == null ? Set.of() : Set.copyOf(materials);
    }

    @Override
    public ContentCategory category() {
      return ContentCategory.CATALOG_ENTRY;
    }

    public boolean hasName() {
      return name != null && !name.isBlank();
    }

    public boolean hasDimensions() {
      return !dimensions.isEmpty();
    }

    public boolean hasAttribution() {
      return attribution != null && !attribution.isBlank();
    }
  }

  /** Page numbers referenced by an index or table-of-contents span. */
  record IndexPayload(List<Integer> pageReferences) implements ContentPayload {

    public IndexPayload {
      pageReferences = List.copyOf(pageReferences);
    }

    @Override
    public ContentCategory category() {
      return ContentCategory.INDEX;
    }
  }

  /** Certification or standard names mentioned in a sustainability notice. */
  record SustainabilityPayload(List<String> certifications) implements ContentPayload {

    public SustainabilityPayload {
      certifications = List.copyOf(certifications);
    }

    @Override
    public ContentCategory category() {
      return ContentCategory.SUSTAINABILITY;
    }
  }

  /** Measurements with units found in a technical specification. */
  record TechnicalSpecPayload(List<String> measurements) implements ContentPayload {

    public TechnicalSpecPayload {
      measurements = List.copyOf(measurements);
    }

    @Override
    public ContentCategory category() {
      return ContentCategory.TECHNICAL_SPEC;
    }
  }

  /** Themes or concepts named on a moodboard page. */
  record MoodboardPayload(List<String> themes) implements ContentPayload {

    public MoodboardPayload {
      themes = List.copyOf(themes);
    }

    @Override
    public ContentCategory category() {
      return ContentCategory.MOODBOARD;
    }
  }

  record UnclassifiedPayload() implements ContentPayload {

    @Override
    public ContentCategory category() {
      return ContentCategory.UNKNOWN;
    }
  }
}
