package com.flamingo.ai.docstructure.service.association;

/** Which targets images are matched against. */
public enum TargetMode {
  /** Retained entity candidates when there are any, otherwise chunks. */
  AUTO,
  ENTITIES,
  CHUNKS
}
