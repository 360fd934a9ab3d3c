package com.termguide.disambiguation.service.vector;

import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local collections. Nothing survives a restart, so there is no active one to reopen. */
@Component
@ConditionalOnProperty(
    name = "guidance.vector-store.type",
    havingValue = "memory",
    matchIfMissing = true)
public class InMemoryVectorIndexFactory implements VectorIndexFactory {

  @Override
  public VectorIndex create(String collectionName) {
    return new InMemoryVectorIndex(collectionName);
  }

  @Override
  public Optional<VectorIndex> openActive() {
    return Optional.empty();
  }

  @Override
  public void markActive(VectorIndex index) {}

  /** Left to the garbage collector once the last reader lets go. */
  @Override
  public void drop(VectorIndex index) {}
}
