package com.yourapp.chatshell.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Comparator;

public record ConversationSummary(
    String id,
    String title,
    @JsonProperty("message_count") int messageCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

  /** Most recently updated first; summaries without a timestamp sort last. */
  public static final Comparator<ConversationSummary> MOST_RECENT_FIRST =
      Comparator.comparing(ConversationSummary::updatedAt,
          Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed();
}
