package com.flamingo.ai.docstructure.service.association;

/** What an association links an image to. */
public enum TargetKind {
  ENTITY,
  CHUNK
}
