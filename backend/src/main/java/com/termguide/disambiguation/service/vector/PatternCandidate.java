package com.termguide.disambiguation.service.vector;

import com.termguide.disambiguation.dto.corpus.Pattern;

import lombok.AllArgsConstructor;
import lombok.Data;

/** A pattern returned by vector search with its cosine similarity to the query. */
@Data
@AllArgsConstructor
public class PatternCandidate {

  private final Pattern pattern;
  private final double similarity;
}
