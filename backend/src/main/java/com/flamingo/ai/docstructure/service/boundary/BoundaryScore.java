package com.flamingo.ai.docstructure.service.boundary;

/**
 * Boundary between a text unit and its successor.
 *
 * @param unitId the unit being scored
 * @param nextUnitId its successor
 * @param strength break strength in [0, 1]
 * @param type boundary type
 * @param semanticSimilarity similarity to the successor, in [-1, 1]
 * @param similaritySource whether the similarity came from embeddings or the heuristic
 * @param entityBoundary whether this break likely separates two entities
 * @param reasoning human-readable explanation
 */
public record BoundaryScore(
    String unitId,
    String nextUnitId,
    double strength,
    BoundaryType type,
    double semanticSimilarity,
    SimilaritySource similaritySource,
    boolean entityBoundary,
    String reasoning) {}
