package com.yourapp.chatshell.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A persisted conversation snapshot. Messages are kept in insertion order and are only ever
 * appended; every append produces a new snapshot through {@link #withMessage(Message)}.
 */
public record Conversation(
    String id,
    String title,
    List<Message> messages,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    Map<String, Object> metadata
) {

  public Conversation {
    messages = messages == null ? List.of() : List.copyOf(messages);
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Conversation create(String id, String title, Instant now) {
    return new Conversation(id, title, List.of(), now, now, Map.of());
  }

  public Conversation withMessage(Message message) {
    List<Message> appended = new ArrayList<>(messages.size() + 1);
    appended.addAll(messages);
    appended.add(message);
    return new Conversation(id, title, appended, createdAt, message.timestamp(), metadata);
  }

  public ConversationSummary summary() {
    return new ConversationSummary(id, title, messages.size(), createdAt, updatedAt);
  }
}
