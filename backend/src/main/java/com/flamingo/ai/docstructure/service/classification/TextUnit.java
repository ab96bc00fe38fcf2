package com.flamingo.ai.docstructure.service.classification;

import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;

/**
 * A normalized span of text produced once per text-bearing layout element.
 *
 * @param id unit identifier
 * @param elementId source layout element id
 * @param text normalized text; a trailing line break marks the end of a block element
 * @param pageNumber 1-based page number
 * @param boundingBox source element position
 * @param heading whether the source element is a heading
 * @param embedding text embedding, or {@code null}
 */
public record TextUnit(
    String id,
    String elementId,
    String text,
    int pageNumber,
    BoundingBox boundingBox,
    boolean heading,
    float[] embedding) {

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  public TextUnit withEmbedding(float[] vector) {
    return new TextUnit(id, elementId, text, pageNumber, boundingBox, heading, vector);
  }
}
