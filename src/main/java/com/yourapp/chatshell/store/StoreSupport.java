package com.yourapp.chatshell.store;

import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.Message;
import java.util.List;
import java.util.Locale;

final class StoreSupport {

  private StoreSupport() {}

  static boolean matches(Conversation conversation, String lowerCaseQuery) {
    if (conversation.title() != null
        && conversation.title().toLowerCase(Locale.ROOT).contains(lowerCaseQuery)) {
      return true;
    }
    for (Message message : conversation.messages()) {
      if (message.content() != null
          && message.content().toLowerCase(Locale.ROOT).contains(lowerCaseQuery)) {
        return true;
      }
    }
    return false;
  }

  /** Offset and limit applied after ordering; negative values count as zero. */
  static <T> List<T> page(List<T> items, int limit, int offset) {
    int from = Math.min(Math.max(offset, 0), items.size());
    int to = Math.min(from + Math.max(limit, 0), items.size());
    return List.copyOf(items.subList(from, to));
  }
}
