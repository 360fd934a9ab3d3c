package com.termguide.disambiguation.service.vector;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A stored vector with its metadata, as held in memory and as serialized to object storage. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorData {

  private String id;
  private Map<String, String> metadata;
  private String document;
  private List<Float> embedding;
  private Instant createdAt;
}
