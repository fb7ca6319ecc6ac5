package com.yourapp.chatshell.store;

/** The preferred backend could not be reached while it was being initialized. */
public class StoreConnectionException extends RuntimeException {

  public StoreConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
