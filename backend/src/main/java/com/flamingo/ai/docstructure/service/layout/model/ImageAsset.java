package com.flamingo.ai.docstructure.service.layout.model;

/**
 * An image in the document, either found in the parsed tree or supplied by the caller.
 *
 * @param id image identifier
 * @param pageNumber 1-based page number
 * @param boundingBox image position (estimated when the tree carries none)
 * @param caption caption text, may be {@code null}
 * @param altText alt text, may be {@code null}
 * @param embedding visual embedding, or {@code null} when none is available
 */
public record ImageAsset(
    String id,
    int pageNumber,
    BoundingBox boundingBox,
    String caption,
    String altText,
    float[] embedding) {

  /** Caption when present, otherwise alt text, otherwise the empty string. */
  public String descriptiveText() {
    if (caption != null && !caption.isBlank()) {
      return caption;
    }
    return altText == null ? "" : altText;
  }

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  public ImageAsset withEmbedding(float[] vector) {
    return new ImageAsset(id, pageNumber, boundingBox, caption, altText, vector);
  }

  public ImageAsset withCaption(String newCaption) {
    return new ImageAsset(id, pageNumber, boundingBox, newCaption, altText, embedding);
  }
}
