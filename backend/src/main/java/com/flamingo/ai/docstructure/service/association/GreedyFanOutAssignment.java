package com.flamingo.ai.docstructure.service.association;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Greedy assignment over candidates sorted by score.
 *
 * <p>Each candidate is taken unless its image or its target has used up its fan-out quota. The
 * result is reproducible but not a maximum-weight matching.
 */
@Slf4j
@Component
public class GreedyFanOutAssignment implements AssignmentStrategy {

  @Override
  public List<Association> assign(
      List<Association> candidates, int maxPerImage, int maxPerTarget) {
    Map<String, Integer> perImage = new HashMap<>();
    Map<String, Integer> perTarget = new HashMap<>();
    List<Association> selected = new ArrayList<>();

    for (Association candidate : candidates) {
      int imageCount = perImage.getOrDefault(candidate.imageId(), 0);
      int targetCount = perTarget.getOrDefault(candidate.targetId(), 0);
      if (imageCount >= maxPerImage || targetCount >= maxPerTarget) {
        continue;
      }
      selected.add(candidate);
      perImage.put(candidate.imageId(), imageCount + 1);
      perTarget.put(candidate.targetId(), targetCount + 1);
    }

    log.debug(
        "{} selected {} of {} candidates (maxPerImage={}, maxPerTarget={})",
        getStrategyName(),
        selected.size(),
        candidates.size(),
        maxPerImage,
        maxPerTarget);
    return selected;
  }

  @Override
  public String getStrategyName() {
    return "GreedyFanOutAssignment";
  }
}
