package com.flamingo.ai.docstructure.service.layout.model;

import java.util.List;

/**
 * A typed element of the layout model.
 *
 * <p>Owned by the {@link LayoutModel}; downstream stages refer to it by {@link #id()} only.
 *
 * @param id stable identifier, unique within the document
 * @param kind semantic kind
 * @param tag source tag name
 * @param classNames source class names
 * @param text trimmed text content (empty for images)
 * @param boundingBox explicit or estimated position
 * @param pageNumber 1-based page number
 * @param hierarchyLevel heading level for headings, DOM depth (capped at 6) otherwise
 * @param headingLevel heading level, or 0 for non-headings
 * @param confidence extraction confidence in [0.5, 1.0]
 * @param semanticTags kind, class and keyword tags
 * @param positionSource whether {@code boundingBox} was explicit
 */
public record LayoutElement(
    String id,
    ElementKind kind,
    String tag,
    List<String> classNames,
    String text,
    BoundingBox boundingBox,
    int pageNumber,
    int hierarchyLevel,
    int headingLevel,
    double confidence,
    List<String> semanticTags,
    PositionSource positionSource) {

  public LayoutElement {
    classNames = classNames == null ? List.of() : List.copyOf(classNames);
    semanticTags = semanticTags == null ? List.of() : List.copyOf(semanticTags);
    text = text == null ? "" : text;
  }

  public boolean isHeading() {
    return kind == ElementKind.HEADING;
  }

  public boolean hasText() {
    return !text.isBlank();
  }
}
