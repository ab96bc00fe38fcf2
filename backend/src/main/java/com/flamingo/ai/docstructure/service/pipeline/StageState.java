package com.flamingo.ai.docstructure.service.pipeline;

public enum StageState {
  SUCCEEDED,
  FAILED,
  /** The stage did not run because its input was missing, it was disabled, or the run stopped. */
  SKIPPED
}
