package com.termguide.disambiguation.dto.guidance;

public enum LookupPath {
  DIRECT,
  VECTOR,
  AGGREGATED,
  NONE
}
