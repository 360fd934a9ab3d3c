package com.termguide.disambiguation.exception;

/** An embedding call failed after its retries were used up. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }

  public EmbeddingException(String message) {
    super(message);
  }
}
