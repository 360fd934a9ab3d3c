package com.termguide.disambiguation.service.vector;

import java.util.List;

/**
 * Maps text to a fixed-length vector. Implementations must be deterministic for a given {@link
 * #getModelId()}: the index is tagged with that id and refuses vectors from any other model.
 */
public interface Embedder {

  List<Float> embed(String text);

  /** Embeds {@code texts} in order; the result has exactly one vector per input. */
  List<List<Float>> embedBatch(List<String> texts);

  String getModelId();
}
