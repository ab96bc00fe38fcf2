package com.flamingo.ai.docstructure.exception;

import com.flamingo.ai.docstructure.service.pipeline.PipelineStage;
import java.util.Locale;

/** Exception thrown when a single pipeline stage fails for one document. */
public class StageExecutionException extends RuntimeException {

  private final PipelineStage stage;
  private final String documentId;

  public StageExecutionException(
      PipelineStage stage, String documentId, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.documentId = documentId;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return "Stage " + stage.name().toLowerCase(Locale.ROOT) + " failed";
  }
}
