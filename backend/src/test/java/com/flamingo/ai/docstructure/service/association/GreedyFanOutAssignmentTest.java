package com.flamingo.ai.docstructure.service.association;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GreedyFanOutAssignment Tests")
class GreedyFanOutAssignmentTest {

  private final GreedyFanOutAssignment strategy = new GreedyFanOutAssignment();

  private static Association candidate(String image, String target, double score) {
    return new Association(
        image, target, TargetKind.ENTITY, score, score, score, score, score, "", 0);
  }

  @Test
  @DisplayName("should take candidates in order until quotas are used up")
  void shouldTakeCandidatesInOrder_untilQuotasUsed() {
    List<Association> sorted =
        List.of(
            candidate("i1", "e1", 0.9),
            candidate("i1", "e2", 0.85),
            candidate("i2", "e1", 0.8),
            candidate("i2", "e2", 0.7));

    List<Association> selected = strategy.assign(sorted, 1, 1);

    assertThat(selected)
        .extracting(a -> a.imageId() + "/" + a.targetId())
        .containsExactly("i1/e1", "i2/e2");
  }

  @Test
  @DisplayName("should not be a maximum-weight matching")
  void shouldStayGreedy() {
    List<Association> sorted =
        List.of(
            candidate("i1", "e1", 0.9),
            candidate("i1", "e2", 0.89),
            candidate("i2", "e1", 0.88));

    List<Association> selected = strategy.assign(sorted, 1, 1);

    assertThat(selected).extracting(Association::targetId).containsExactly("e1");
    assertThat(strategy.getStrategyName()).isEqualTo("GreedyFanOutAssignment");
  }

  @Test
  @DisplayName("should return nothing when quotas are zero")
  void shouldReturnNothing_whenQuotasZero() {
    assertThat(strategy.assign(List.of(candidate("i", "e", 1.0)), 0, 5)).isEmpty();
  }
}
