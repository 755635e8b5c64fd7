package com.papertrail.core.task.model;

public class StreamingPoolException extends RuntimeException {
  public StreamingPoolException(String message) {
    super(message);
  }

  public StreamingPoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
