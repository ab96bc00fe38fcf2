package com.flamingo.ai.docstructure.service.boundary;

/** Where a boundary's semantic-similarity value came from. */
public enum SimilaritySource {
  /** Cosine similarity of the two units' embeddings. */
  EMBEDDING,
  /** Length-ratio and first-token heuristic, used when an embedding is missing. */
  HEURISTIC
}
