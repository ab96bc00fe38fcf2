package com.flamingo.ai.docstructure.service.association;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final association set for one document plus summary statistics.
 *
 * @param associations assigned associations, overall score descending
 * @param totalEvaluated image/target pairs scored
 * @param averageConfidence mean confidence of the assigned associations, 0 when none
 * @param scoreBands assigned associations per overall-score band
 */
public record AssociationReport(
    List<Association> associations,
    int totalEvaluated,
    double averageConfidence,
    Map<ScoreBand, Integer> scoreBands) {

  public AssociationReport {
    associations = List.copyOf(associations);
    scoreBands = Map.copyOf(scoreBands);
  }

  public static AssociationReport empty() {
    return new AssociationReport(List.of(), 0, 0.0, bandCounts(List.of()));
  }

  /** Counts associations per band; every band is present in the result. */
  public static Map<ScoreBand, Integer> bandCounts(List<Association> associations) {
    Map<ScoreBand, Integer> counts = new EnumMap<>(ScoreBand.class);
    for (ScoreBand band : ScoreBand.values()) {
      counts.put(band, 0);
    }
    for (Association association : associations) {
      counts.merge(ScoreBand.of(association.overallScore()), 1, Integer::sum);
    }
    return counts;
  }
}
