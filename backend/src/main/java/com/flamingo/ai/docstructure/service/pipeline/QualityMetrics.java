package com.flamingo.ai.docstructure.service.pipeline;

/**
 * Aggregate quality of one pipeline run.
 *
 * <p>A component that is unavailable (its stage failed or produced nothing) is reported as 0 and
 * left out of {@code overallQuality}, which is the mean of the available components.
 */
public record QualityMetrics(
    double layoutConfidence,
    double chunkQuality,
    double associationConfidence,
    double overallQuality,
    int chunkCount,
    int associationCount,
    int undersizedChunks,
    int oversizedChunks) {

  public static QualityMetrics empty() {
    return new QualityMetrics(0.0, 0.0, 0.0, 0.0, 0, 0, 0, 0);
  }
}
