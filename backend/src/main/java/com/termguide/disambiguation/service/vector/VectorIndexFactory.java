package com.termguide.disambiguation.service.vector;

import java.util.Optional;

/** Creates collections and tracks which one is live, so rebuilds can populate a fresh one. */
public interface VectorIndexFactory {

  VectorIndex create(String collectionName);

  /** The collection last marked active by a previous process, if the store persists one. */
  Optional<VectorIndex> openActive();

  void markActive(VectorIndex index);

  /**
   * Releases the storage of a collection that is no longer live. Callers that still hold the
   * collection keep a readable view of it.
   */
  void drop(VectorIndex index);
}
