package com.flamingo.ai.docstructure.service.boundary;

import java.util.List;

/** Vector math shared by boundary detection, clustering and association scoring. */
public final class VectorSimilarity {

  private VectorSimilarity() {}

  /**
   * Cosine similarity in [-1, 1].
   *
   * <p>Vectors of different length come from different embedding spaces and score 0, as do
   * {@code null}, empty or zero-norm vectors.
   */
  public static double cosine(float[] a, float[] b) {
    if (a == null || b == null || a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    double denominator = Math.sqrt(normA) * Math.sqrt(normB);
    if (denominator == 0.0) {
      return 0.0;
    }
    return Math.max(-1.0, Math.min(1.0, dot / denominator));
  }

  /**
   * Component-wise mean of the vectors that share the first vector's dimension.
   *
   * @return the centroid, or an empty array for no input
   */
  public static float[] centroid(List<float[]> vectors) {
    if (vectors == null || vectors.isEmpty()) {
      return new float[0];
    }
    int dimension = vectors.get(0).length;
    double[] sum = new double[dimension];
    int count = 0;
    for (float[] vector : vectors) {
      if (vector.length != dimension) {
        continue;
      }
      for (int i = 0; i < dimension; i++) {
        sum[i] += vector[i];
      }
      count++;
    }
    float[] result = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      result[i] = (float) (sum[i] / count);
    }
    return result;
  }

  /**
   * Mean cosine similarity of the members to the centroid.
   *
   * @return coherence, 0 for no members
   */
  public static double coherence(List<float[]> members, float[] centroid) {
    if (members == null || members.isEmpty()) {
      return 0.0;
    }
    double total = 0.0;
    for (float[] member : members) {
      total += cosine(member, centroid);
    }
    return total / members.size();
  }
}
