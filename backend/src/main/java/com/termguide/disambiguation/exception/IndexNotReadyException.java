package com.termguide.disambiguation.exception;

public class IndexNotReadyException extends RuntimeException {

  public IndexNotReadyException(String message) {
    super(message);
  }
}
