package com.flamingo.ai.docstructure.service.classification;

import com.flamingo.ai.docstructure.service.association.AssociationTarget;
import com.flamingo.ai.docstructure.service.association.TargetKind;
import com.flamingo.ai.docstructure.service.layout.model.BoundingBox;

/**
 * Classified, field-extracted text span. Immutable once created.
 *
 * @param id candidate identifier
 * @param unitId source text unit id
 * @param category content category
 * @param confidence pattern confidence in [0, 1]
 * @param qualityScore extraction quality in [0, 1]; 0 for non-catalog categories
 * @param payload category-specific extraction
 * @param pageNumber 1-based page number
 * @param boundingBox source position
 * @param text source text
 * @param embedding text embedding, or {@code null}
 */
public record EntityCandidate(
    String id,
    String unitId,
    ContentCategory category,
    double confidence,
    double qualityScore,
    ContentPayload payload,
    int pageNumber,
    BoundingBox boundingBox,
    String text,
    float[] embedding)
    implements AssociationTarget {

  public EntityCandidate withEmbedding(float[] vector) {
    return new EntityCandidate(
        id, unitId, category, confidence, qualityScore, payload, pageNumber, boundingBox, text,
        vector);
  }

  @Override
  public String targetId() {
    return id;
  }

  @Override
  public TargetKind targetKind() {
    return TargetKind.ENTITY;
  }

  @Override
  public String name() {
    if (payload instanceof ContentPayload.CatalogEntryPayload catalog && catalog.hasName()) {
      return catalog.name();
    }
    return null;
  }

  @Override
  public String description() {
    return text;
  }
}
