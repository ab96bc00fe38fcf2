package com.flamingo.ai.docstructure.service.classification;

/** Closed set of content categories, checked in declaration order after CATALOG_ENTRY. */
public enum ContentCategory {
  CATALOG_ENTRY,
  INDEX,
  SUSTAINABILITY,
  TECHNICAL_SPEC,
  MOODBOARD,
  UNKNOWN
}
