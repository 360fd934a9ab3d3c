package com.termguide.disambiguation.service.vector;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.termguide.disambiguation.exception.EmbeddingSpaceMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * Brute-force cosine search over a concurrent map. Adequate for corpora of a few thousand patterns,
 * which is the size this engine is used with.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

  private final String name;
  private final Map<String, VectorData> vectors = new ConcurrentHashMap<>();
  private final Map<String, String> tags = new ConcurrentHashMap<>();
  private volatile int dimension = -1;

  public InMemoryVectorIndex(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public void upsert(String id, List<Float> vector, Map<String, String> metadata, String document) {
    if (id == null || vector == null || vector.isEmpty()) {
      throw new IllegalArgumentException("Cannot store a vector without an id and values");
    }
    checkDimension(vector.size());
    store(
        VectorData.builder()
            .id(id)
            .embedding(List.copyOf(vector))
            .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
            .document(document)
            .createdAt(Instant.now())
            .build());
  }

  /** Puts an already-built record into the map, used when reloading persisted collections. */
  protected void store(VectorData data) {
    checkDimension(data.getEmbedding().size());
    vectors.put(data.getId(), data);
  }

  protected VectorData get(String id) {
    return vectors.get(id);
  }

  @Override
  public List<VectorMatch> query(List<Float> vector, int k, Map<String, String> filter) {
    if (k <= 0 || vectors.isEmpty()) {
      return List.of();
    }
    if (dimension > 0 && vector.size() != dimension) {
      throw new EmbeddingSpaceMismatchException(
          String.format(
              "Query vector has %d dimensions but collection '%s' holds %d-dimensional vectors",
              vector.size(), name, dimension));
    }
    return vectors.values().stream()
        .filter(data -> matches(data, filter))
        .map(
            data ->
                new VectorMatch(
                    data.getId(),
                    1.0 - VectorMath.cosine(vector, data.getEmbedding()),
                    data.getMetadata(),
                    data.getDocument()))
        .sorted(Comparator.comparingDouble(VectorMatch::getDistance))
        .limit(k)
        .collect(Collectors.toList());
  }

  @Override
  public List<VectorData> scan(Map<String, String> filter) {
    return vectors.values().stream()
        .filter(data -> matches(data, filter))
        .collect(Collectors.toList());
  }

  @Override
  public int count() {
    return vectors.size();
  }

  @Override
  public void clear() {
    int removed = vectors.size();
    vectors.clear();
    dimension = -1;
    log.debug("Cleared {} vectors from collection {}", removed, name);
  }

  @Override
  public Map<String, String> getTags() {
    return Map.copyOf(tags);
  }

  @Override
  public void putTag(String key, String value) {
    tags.put(key, value);
  }

  private synchronized void checkDimension(int size) {
    if (dimension < 0) {
      dimension = size;
    } else if (dimension != size) {
      throw new EmbeddingSpaceMismatchException(
          String.format(
              "Collection '%s' holds %d-dimensional vectors, refusing a %d-dimensional one",
              name, dimension, size));
    }
  }

  private static boolean matches(VectorData data, Map<String, String> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    Map<String, String> metadata = data.getMetadata();
    return metadata != null
        && filter.entrySet().stream()
            .allMatch(entry -> entry.getValue().equals(metadata.get(entry.getKey())));
  }
}
