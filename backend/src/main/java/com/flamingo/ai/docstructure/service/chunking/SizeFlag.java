package com.flamingo.ai.docstructure.service.chunking;

/** Outcome of the final size validation pass. Flagged chunks are kept. */
public enum SizeFlag {
  WITHIN_BOUNDS,
  UNDERSIZED,
  OVERSIZED
}
