package com.yourapp.chatshell.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yourapp.chatshell.model.Conversation;
import java.time.Instant;

/** On-disk envelope of a single conversation file. */
public record ConversationDocument(
    Conversation conversation,
    @JsonProperty("export_timestamp") Instant exportTimestamp,
    String version
) {

  public static final String CURRENT_VERSION = "1.0";
}
