package com.polytick.core.feed;

public class FeedDisconnectedException extends FeedException {

  public FeedDisconnectedException(String message) {
    super(message);
  }

  public FeedDisconnectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
