package com.yourapp.chatshell.conversation;

import com.yourapp.chatshell.model.Message;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded slice of the most recent messages, oldest first. Message content is passed through
 * untouched.
 */
public final class ContextWindow {

  private ContextWindow() {}

  public static List<ContextMessage> of(List<Message> messages, int maxMessages) {
    if (messages == null || messages.isEmpty() || maxMessages <= 0) {
      return List.of();
    }
    int from = Math.max(0, messages.size() - maxMessages);
    List<ContextMessage> window = new ArrayList<>(messages.size() - from);
    for (Message message : messages.subList(from, messages.size())) {
      window.add(new ContextMessage(message.role(), message.content(), message.timestamp()));
    }
    return List.copyOf(window);
  }
}
