package com.flamingo.ai.docstructure.service.association;

/**
 * Scored link between one image and one target. Immutable once scored.
 *
 * @param imageId image identifier
 * @param targetId entity or chunk identifier
 * @param targetKind what the target is
 * @param spatialScore page-proximity score in [0, 1]
 * @param lexicalScore caption/description word overlap in [0, 1]
 * @param visualScore visual-semantic similarity in [0, 1]
 * @param overallScore weighted sum of the three scores
 * @param confidence overall score boosted by agreement between the three scores
 * @param reasoning human-readable explanation
 * @param pageDifference absolute page distance between image and target
 */
public record Association(
    String imageId,
    String targetId,
    TargetKind targetKind,
    double spatialScore,
    double lexicalScore,
    double visualScore,
    double overallScore,
    double confidence,
    String reasoning,
    int pageDifference) {}
