package com.flamingo.ai.docstructure.service.chunking;

/** Dominant element kind of a chunk; MIXED when its elements differ. */
public enum ChunkType {
  HEADING,
  PARAGRAPH,
  TABLE,
  LIST,
  MIXED
}
