package com.yourapp.chatshell.store;

/** A stored conversation record is corrupt or does not match the expected shape. */
public class ConversationParseException extends RuntimeException {

  public ConversationParseException(String message) {
    super(message);
  }

  public ConversationParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
