package com.yourapp.chatshell.store;

import com.yourapp.chatshell.model.ConversationSummary;
import java.util.List;

/** Optional full-text index consulted by the Redis store before it falls back to a manual scan. */
public interface ConversationSearchIndex {

  /** Probes for the indexing feature and creates the index when it is present. */
  void initialize();

  boolean isAvailable();

  /**
   * Runs an indexed query, most recently updated first.
   *
   * @throws RuntimeException when the query cannot be executed; callers fall back to scanning
   */
  List<ConversationSummary> search(String query, int limit);

  static ConversationSearchIndex unavailable() {
    return new ConversationSearchIndex() {
      @Override
      public void initialize() {}

      @Override
      public boolean isAvailable() {
        return false;
      }

      @Override
      public List<ConversationSummary> search(String query, int limit) {
        throw new UnsupportedOperationException("Full-text search is not available");
      }
    };
  }
}
