package com.flamingo.ai.docstructure.service.boundary;

/** Kind of logical break between two adjacent text units. */
public enum BoundaryType {
  SENTENCE,
  PARAGRAPH,
  SECTION,
  SEMANTIC,
  WEAK
}
