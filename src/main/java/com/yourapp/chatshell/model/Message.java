package com.yourapp.chatshell.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Message(
    String id,
    MessageRole role,
    String content,
    Instant timestamp,
    Map<String, Object> metadata
) {

  public Message {
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
