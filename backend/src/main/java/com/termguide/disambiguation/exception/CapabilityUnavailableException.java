package com.termguide.disambiguation.exception;

public class CapabilityUnavailableException extends RuntimeException {

  public CapabilityUnavailableException(String message) {
    super(message);
  }

  public CapabilityUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
