package com.flamingo.ai.docstructure.service.pipeline;

import com.flamingo.ai.docstructure.service.association.AssociationReport;
import com.flamingo.ai.docstructure.service.boundary.BoundaryScore;
import com.flamingo.ai.docstructure.service.boundary.SemanticCluster;
import com.flamingo.ai.docstructure.service.chunking.LayoutChunk;
import com.flamingo.ai.docstructure.service.classification.EntityCandidate;
import com.flamingo.ai.docstructure.service.layout.model.LayoutModel;
import java.util.List;
import java.util.Optional;

/**
 * Output of one pipeline run. Outputs of stages that failed or were skipped are empty; outputs of
 * the stages that succeeded are kept.
 */
public record PipelineResult(
    String documentId,
    LayoutModel layout,
    List<EntityCandidate> entities,
    List<BoundaryScore> boundaries,
    List<SemanticCluster> clusters,
    List<LayoutChunk> chunks,
    AssociationReport associations,
    List<StageStatus> stageStatuses,
    QualityMetrics metrics) {

  static final String CANCELLED = "cancelled";

  public PipelineResult {
    entities = entities == null ? List.of() : List.copyOf(entities);
    boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
    clusters = clusters == null ? List.of() : List.copyOf(clusters);
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    associations = associations == null ? AssociationReport.empty() : associations;
    stageStatuses = List.copyOf(stageStatuses);
    metrics = metrics == null ? QualityMetrics.empty() : metrics;
  }

  public Optional<StageStatus> status(PipelineStage stage) {
    return stageStatuses.stream().filter(s -> s.stage() == stage).findFirst();
  }

  public StageState state(PipelineStage stage) {
    return status(stage).map(StageStatus::state).orElse(StageState.SKIPPED);
  }

  public List<PipelineStage> failedStages() {
    return stageStatuses.stream().filter(StageStatus::isFailed).map(StageStatus::stage).toList();
  }

  /** True when no stage failed. Skipped stages do not count as failures. */
  public boolean isSuccessful() {
    return failedStages().isEmpty();
  }

  /** True when the run stopped early because its thread was interrupted. */
  public boolean isCancelled() {
    return stageStatuses.stream()
        .anyMatch(s -> s.state() == StageState.SKIPPED && CANCELLED.equals(s.message()));
  }
}
