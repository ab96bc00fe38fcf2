package com.flamingo.ai.docstructure.service.layout.model;

/** Semantic kind of a layout element. */
public enum ElementKind {
  HEADING,
  PARAGRAPH,
  TABLE,
  LIST,
  IMAGE,
  /** Generic container (div, span, section) with no more specific role. */
  CONTAINER
}
