package com.flamingo.ai.docstructure.service.chunking;

import com.flamingo.ai.docstructure.service.boundary.BoundaryScore;
import com.flamingo.ai.docstructure.service.classification.TextUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Boundary information the chunker consumes: the elements after which an entity boundary was
 * detected.
 *
 * @param entityBoundaryElementIds ids of elements whose text unit ends an entity
 */
public record BoundarySignal(Set<String> entityBoundaryElementIds) {

  public BoundarySignal {
    entityBoundaryElementIds = Set.copyOf(entityBoundaryElementIds);
  }

  /** Signal with no boundaries, used when boundary detection did not run. */
  public static BoundarySignal none() {
    return new BoundarySignal(Set.of());
  }

  /**
   * Maps boundary scores back to the elements their units came from.
   *
   * @param units the scored units
   * @param scores boundary scores keyed by unit id
   * @return the signal
   */
  public static BoundarySignal from(List<TextUnit> units, List<BoundaryScore> scores) {
    Map<String, String> elementByUnit = new HashMap<>();
    for (TextUnit unit : units) {
      elementByUnit.put(unit.id(), unit.elementId());
    }
    Set<String> ids = new HashSet<>();
    for (BoundaryScore score : scores) {
      String elementId = elementByUnit.get(score.unitId());
      if (score.entityBoundary() && elementId != null) {
        ids.add(elementId);
      }
    }
    return new BoundarySignal(ids);
  }

  public boolean endsEntity(String elementId) {
    return entityBoundaryElementIds.contains(elementId);
  }
}
