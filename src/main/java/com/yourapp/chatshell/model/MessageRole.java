package com.yourapp.chatshell.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MessageRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String value;

  MessageRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static MessageRole fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (MessageRole role : values()) {
        if (role.value.equals(normalized)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException("Unknown message role: " + value);
  }
}
