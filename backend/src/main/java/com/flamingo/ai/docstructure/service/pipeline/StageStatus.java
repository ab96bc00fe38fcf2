package com.flamingo.ai.docstructure.service.pipeline;

/**
 * Outcome of one stage for one document.
 *
 * @param stage the stage
 * @param state whether it ran, failed or was skipped
 * @param message summary of the output, the failure, or the reason for skipping
 * @param durationMillis wall time spent in the stage; 0 when skipped
 */
public record StageStatus(
    PipelineStage stage, StageState state, String message, long durationMillis) {

  public static StageStatus succeeded(PipelineStage stage, String message, long durationMillis) {
    return new StageStatus(stage, StageState.SUCCEEDED, message, durationMillis);
  }

  public static StageStatus failed(PipelineStage stage, String message, long durationMillis) {
    return new StageStatus(stage, StageState.FAILED, message, durationMillis);
  }

  public static StageStatus skipped(PipelineStage stage, String reason) {
    return new StageStatus(stage, StageState.SKIPPED, reason, 0L);
  }

  public boolean isFailed() {
    return state == StageState.FAILED;
  }
}
