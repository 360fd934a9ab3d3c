package com.termguide.disambiguation.dto.guidance;

public enum ConfidenceTier {
  /** Safe to present downstream as an authoritative suggestion. */
  INJECT,
  /** Kept for review, not injected unless suggestions are requested. */
  LOG,
  /** Discarded. */
  IGNORE
}
