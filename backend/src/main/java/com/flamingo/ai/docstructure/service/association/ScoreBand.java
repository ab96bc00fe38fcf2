package com.flamingo.ai.docstructure.service.association;

/** Qualitative band of an association's overall score. */
public enum ScoreBand {
  /** 0.8 and above. */
  HIGH,
  /** 0.6 up to 0.8. */
  GOOD,
  /** 0.4 up to 0.6. */
  MODERATE,
  /** Below 0.4. */
  LOW;

  public static ScoreBand of(double score) {
    if (score >= 0.8) {
      return HIGH;
    }
    if (score >= 0.6) {
      return GOOD;
    }
    if (score >= 0.4) {
      return MODERATE;
    }
    return LOW;
  }
}
