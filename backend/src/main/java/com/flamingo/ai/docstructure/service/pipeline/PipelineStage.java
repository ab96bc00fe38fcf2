package com.flamingo.ai.docstructure.service.pipeline;

/** Stages of the document structure pipeline, in execution order. */
public enum PipelineStage {
  LAYOUT,
  CLASSIFICATION,
  EMBEDDING,
  BOUNDARY,
  CHUNKING,
  ASSOCIATION
}
