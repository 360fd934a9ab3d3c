package com.termguide.disambiguation.service.vector;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/** One nearest-neighbour hit. Distance is cosine distance; similarity is {@code 1 - distance}. */
@Data
@Builder
@AllArgsConstructor
public class VectorMatch {

  private String id;
  private double distance;
  private Map<String, String> metadata;
  private String document;

  public double similarity() {
    return 1.0 - distance;
  }
}
