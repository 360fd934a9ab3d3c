package com.termguide.disambiguation.service.vector;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour store for one collection. Distance is cosine distance. A collection carries
 * string tags; {@link #TAG_EMBEDDING_MODEL_ID} names the embedding space of every vector in it.
 */
public interface VectorIndex {

  String TAG_EMBEDDING_MODEL_ID = "embedding_model_id";
  String TAG_CORPUS_VERSION = "corpus_version";

  String getName();

  /** Inserts or replaces the vector stored under {@code id}. */
  void upsert(String id, List<Float> vector, Map<String, String> metadata, String document);

  /**
   * Returns at most {@code k} hits ordered by ascending distance. A non-empty {@code filter}
   * restricts hits to vectors whose metadata contains every filter entry.
   */
  List<VectorMatch> query(List<Float> vector, int k, Map<String, String> filter);

  /** All stored vectors matching {@code filter}, in no particular order. */
  List<VectorData> scan(Map<String, String> filter);

  int count();

  void clear();

  Map<String, String> getTags();

  void putTag(String key, String value);

  default String getEmbeddingModelId() {
    return getTags().get(TAG_EMBEDDING_MODEL_ID);
  }
}
