package com.termguide.disambiguation.exception;

/**
 * The corpus document could not be parsed into categories and patterns. Loading stops at the first
 * structural problem so no partially-populated index is ever built from it.
 */
public class CorpusFormatException extends RuntimeException {

  private final String source;

  public CorpusFormatException(String source, String message) {
    super("Malformed corpus '" + source + "': " + message);
    this.source = source;
  }

  public CorpusFormatException(String source, String message, Throwable cause) {
    super("Malformed corpus '" + source + "': " + message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
