package com.termguide.disambiguation.dto.corpus;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A confirmed false-positive example for one category. The embedding is empty when the anchor comes
 * straight from the corpus and is filled in by the index build with {@link #withEmbedding(List)}.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "embedding")
@EqualsAndHashCode
public class NegativeAnchor {

  private final String category;
  private final int categoryId;
  private final String sourceText;
  private final List<Float> embedding;

  public NegativeAnchor withEmbedding(List<Float> vector) {
    return toBuilder().embedding(List.copyOf(vector)).build();
  }

  public boolean isEmbedded() {
    return embedding != null && !embedding.isEmpty();
  }
}
