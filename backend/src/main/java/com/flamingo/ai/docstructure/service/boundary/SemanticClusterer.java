package com.flamingo.ai.docstructure.service.boundary;

import com.flamingo.ai.docstructure.config.StructureConfig;
import com.flamingo.ai.docstructure.service.classification.TextUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups text units by embedding similarity with a deterministic k-means.
 *
 * <p>Seeds are chosen farthest-first starting from the first unit, members are assigned to the
 * most similar centroid (lowest index on ties) and centroids are recomputed until assignments stop
 * changing or the iteration bound is hit. Units without an embedding, or whose embedding has a
 * different dimension from the first embedded unit, are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticClusterer {

  /** Clusters with more members than this are treated as describing one entity. */
  private static final int ENTITY_CLUSTER_MIN_EXCLUSIVE = 2;

  private static final int DEFAULT_MAX_CLUSTERS = 5;

  private final StructureConfig structureConfig;

  /**
   * Clusters the embedded units.
   *
   * @param units text units in document order
   * @return non-empty clusters ordered by their first member
   */
  public List<SemanticCluster> cluster(List<TextUnit> units) {
    List<TextUnit> embedded = new ArrayList<>();
    for (TextUnit unit : units) {
      if (unit.hasEmbedding()
          && (embedded.isEmpty()
              || unit.embedding().length == embedded.get(0).embedding().length)) {
        embedded.add(unit);
      }
    }
    if (embedded.isEmpty()) {
      return List.of();
    }

    int n = embedded.size();
    int k = clusterCount(n);
    List<float[]> vectors = embedded.stream().map(TextUnit::embedding).toList();

    float[][] centroids = seed(vectors, k);
    int[] assignment = new int[n];
    Arrays.fill(assignment, -1);

    int maxIterations = Math.max(1, structureConfig.getBoundary().getMaxClusterIterations());
    int iteration = 0;
    boolean changed = true;
    while (changed && iteration < maxIterations) {
      changed = false;
      for (int i = 0; i < n; i++) {
        int best = nearest(vectors.get(i), centroids);
        if (best != assignment[i]) {
          assignment[i] = best;
          changed = true;
        }
      }
      for (int c = 0; c < k; c++) {
        List<float[]> members = membersOf(c, assignment, vectors);
        if (!members.isEmpty()) {
          centroids[c] = VectorSimilarity.centroid(members);
        }
      }
      iteration++;
    }

    List<SemanticCluster> clusters = new ArrayList<>();
    for (int c = 0; c < k; c++) {
      List<String> unitIds = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        if (assignment[i] == c) {
          unitIds.add(embedded.get(i).id());
        }
      }
      if (unitIds.isEmpty()) {
        continue;
      }
      List<float[]> members = membersOf(c, assignment, vectors);
      clusters.add(
          new SemanticCluster(
              "cluster_" + clusters.size(),
              unitIds,
              centroids[c],
              VectorSimilarity.coherence(members, centroids[c]),
              unitIds.size(),
              unitIds.size() > ENTITY_CLUSTER_MIN_EXCLUSIVE));
    }

    log.debug(
        "Clustered {} embedded units into {} clusters after {} iterations",
        n,
        clusters.size(),
        iteration);
    return clusters;
  }

  private int clusterCount(int n) {
    int configured = structureConfig.getBoundary().getClusterCount();
    if (configured > 0) {
      return Math.min(configured, n);
    }
    return Math.min(DEFAULT_MAX_CLUSTERS, (int) Math.ceil(Math.sqrt(n)));
  }

  /** Farthest-point seeding: each new seed is the vector least similar to its closest seed. */
  private float[][] seed(List<float[]> vectors, int k) {
    float[][] centroids = new float[k][];
    List<Integer> chosen = new ArrayList<>();
    chosen.add(0);
    centroids[0] = vectors.get(0).clone();

    for (int c = 1; c < k; c++) {
      int candidate = -1;
      double lowest = Double.MAX_VALUE;
      for (int i = 0; i < vectors.size(); i++) {
        if (chosen.contains(i)) {
          continue;
        }
        double closest = -Double.MAX_VALUE;
        for (int s : chosen) {
          closest = Math.max(closest, VectorSimilarity.cosine(vectors.get(i), vectors.get(s)));
        }
        if (closest < lowest) {
          lowest = closest;
          candidate = i;
        }
      }
      chosen.add(candidate);
      centroids[c] = vectors.get(candidate).clone();
    }
    return centroids;
  }

  private int nearest(float[] vector, float[][] centroids) {
    int best = 0;
    double bestSimilarity = -Double.MAX_VALUE;
    for (int c = 0; c < centroids.length; c++) {
      double similarity = VectorSimilarity.cosine(vector, centroids[c]);
      if (similarity > bestSimilarity) {
        bestSimilarity = similarity;
        best = c;
      }
    }
    return best;
  }

  private static List<float[]> membersOf(int cluster, int[] assignment, List<float[]> vectors) {
    List<float[]> members = new ArrayList<>();
    for (int i = 0; i < assignment.length; i++) {
      if (assignment[i] == cluster) {
        members.add(vectors.get(i));
      }
    }
    return members;
  }
}
