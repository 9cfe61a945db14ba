package com.polytick.core.feed;

/**
 * Transient upstream failure: logged by the caller and retried on the next natural cycle.
 */
public class FeedException extends RuntimeException {

  public FeedException(String message) {
    super(message);
  }

  public FeedException(String message, Throwable cause) {
    super(message, cause);
  }
}
