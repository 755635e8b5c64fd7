package com.papertrail.search;

public class SearchStreamException extends RuntimeException {

  public SearchStreamException(String message) {
    super(message);
  }

  public SearchStreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
