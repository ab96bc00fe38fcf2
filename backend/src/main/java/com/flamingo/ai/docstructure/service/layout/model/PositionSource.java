package com.flamingo.ai.docstructure.service.layout.model;

/** Whether an element's bounding box came from explicit metadata or was estimated. */
public enum PositionSource {
  EXPLICIT,
  ESTIMATED
}
