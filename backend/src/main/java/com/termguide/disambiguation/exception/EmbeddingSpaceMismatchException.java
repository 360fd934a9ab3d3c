package com.termguide.disambiguation.exception;

/** Raised when a query vector and an indexed collection come from different embedding models. */
public class EmbeddingSpaceMismatchException extends RuntimeException {

  private final String indexModelId;
  private final String queryModelId;

  public EmbeddingSpaceMismatchException(String indexModelId, String queryModelId) {
    super(
        String.format(
            "Index was built with embedding model '%s' but queries use '%s'; rebuild the index",
            indexModelId, queryModelId));
    this.indexModelId = indexModelId;
    this.queryModelId = queryModelId;
  }

  public EmbeddingSpaceMismatchException(String message) {
    super(message);
    this.indexModelId = null;
    this.queryModelId = null;
  }

  public String getIndexModelId() {
    return indexModelId;
  }

  public String getQueryModelId() {
    return queryModelId;
  }
}
