package com.yourapp.chatshell.store;

import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persistence contract shared by every conversation backend.
 *
 * <p>Implementations never throw past this boundary: a backend fault is logged and turned into the
 * failure value of the operation (empty, {@code false}, {@code 0} or an empty list). Results of
 * {@link #list} and {@link #search} are ordered by {@code updated_at}, most recent first.
 */
public interface ConversationStore {

  int DEFAULT_LIST_LIMIT = 50;
  int DEFAULT_SEARCH_LIMIT = 20;
  int DEFAULT_CLEANUP_DAYS = 30;

  /** Overwrites any state previously persisted for the conversation id. */
  boolean save(Conversation conversation);

  Optional<Conversation> load(String conversationId);

  /** Returns {@code true} only when a record existed and was removed. */
  boolean delete(String conversationId);

  List<ConversationSummary> list(int limit, int offset);

  /** Case-insensitive containment match on the title or any message content. */
  List<ConversationSummary> search(String query, int limit);

  Map<String, Object> stats();

  /** Deletes conversations whose {@code updated_at} is strictly older than now minus {@code days}. */
  int cleanup(int days);

  String name();

  Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

  static boolean isValidId(String conversationId) {
    return conversationId != null && ID_PATTERN.matcher(conversationId).matches();
  }
}
