package com.polytick.core.store;

public class StoreWriteException extends RuntimeException {

  public StoreWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
