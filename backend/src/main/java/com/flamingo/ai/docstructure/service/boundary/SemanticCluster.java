package com.flamingo.ai.docstructure.service.boundary;

import java.util.List;

/**
 * Group of text units with similar embeddings.
 *
 * @param clusterId cluster identifier
 * @param unitIds member unit ids in document order
 * @param centroid mean member embedding
 * @param coherence mean cosine similarity of members to the centroid, 0 when empty
 * @param size member count
 * @param entityCluster whether the group is large enough to describe one entity
 */
public record SemanticCluster(
    String clusterId,
    List<String> unitIds,
    float[] centroid,
    double coherence,
    int size,
    boolean entityCluster) {

  public SemanticCluster {
    unitIds = List.copyOf(unitIds);
  }
}
