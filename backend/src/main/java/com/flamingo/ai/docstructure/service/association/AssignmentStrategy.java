package com.flamingo.ai.docstructure.service.association;

import java.util.List;

/**
 * Resolves scored image/target candidates into the final association set.
 *
 * <p>Implementations must be deterministic: identical candidates yield identical output.
 */
public interface AssignmentStrategy {

  /**
   * Selects associations under the fan-out caps.
   *
   * @param candidates accepted candidates, overall score descending with id tie-breaks
   * @param maxPerImage maximum associations per image
   * @param maxPerTarget maximum associations per target
   * @return the selected associations, in candidate order
   */
  List<Association> assign(List<Association> candidates, int maxPerImage, int maxPerTarget);

  String getStrategyName();
}
