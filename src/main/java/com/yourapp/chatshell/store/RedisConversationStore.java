package com.yourapp.chatshell.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import com.yourapp.chatshell.model.Message;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed conversation store.
 *
 * <p>Key layout: {@code conversation:{id}} is a hash of summary fields plus the full JSON body,
 * {@code message:{id}:{n}} is a hash per message, and the set {@code conversations} holds every
 * known id.
 *
 * <p>Every save refreshes an expiry window on the conversation and message keys. A conversation
 * that is not written for longer than that window disappears from Redis on its own, independently
 * of {@link #cleanup(int)}. Ids left behind in the {@code conversations} set by such an expiry are
 * pruned by the next scan.
 *
 * <p>The writes of one save are not atomic: a crash between them can leave the summary fields and
 * the stored body out of step.
 */
public class RedisConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(RedisConversationStore.class);

  static final String CONVERSATION_KEY_PREFIX = "conversation:";
  static final String MESSAGE_KEY_PREFIX = "message:";
  static final String CONVERSATIONS_SET = "conversations";

  static final String ID = "id";
  static final String TITLE = "title";
  static final String CREATED_AT = "created_at";
  static final String UPDATED_AT = "updated_at";
  static final String CREATED_AT_MS = "created_at_ms";
  static final String UPDATED_AT_MS = "updated_at_ms";
  static final String MESSAGE_COUNT = "message_count";
  static final String CONTENT = "content";
  static final String DATA = "data";

  private static final List<String> SUMMARY_FIELDS =
      List.of(ID, TITLE, CREATED_AT, UPDATED_AT, MESSAGE_COUNT);

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final ConversationSearchIndex searchIndex;
  private final Duration ttl;
  private final int contentLimit;
  private final Clock clock;

  public RedisConversationStore(
      StringRedisTemplate redis,
      ObjectMapper mapper,
      ConversationSearchIndex searchIndex,
      Duration ttl,
      int contentLimit,
      Clock clock) {
    this.redis = redis;
    this.mapper = mapper;
    this.searchIndex = searchIndex;
    this.ttl = ttl;
    this.contentLimit = contentLimit;
    this.clock = clock;

    try {
      redis.execute((RedisCallback<String>) connection -> connection.ping());
    } catch (RuntimeException e) {
      throw new StoreConnectionException("Failed to connect to Redis", e);
    }
    log.info("Connected to Redis successfully");
    searchIndex.initialize();
  }

  public boolean isConnected() {
    try {
      String pong = redis.execute((RedisCallback<String>) connection -> connection.ping());
      return "PONG".equalsIgnoreCase(pong);
    } catch (RuntimeException e) {
      log.debug("Redis ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public boolean save(Conversation conversation) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot save conversation {}", conversation.id());
      return false;
    }
    if (!ConversationStore.isValidId(conversation.id())) {
      log.error("Refusing to save conversation with invalid id '{}'", conversation.id());
      return false;
    }

    try {
      String id = conversation.id();
      String key = conversationKey(id);
      HashOperations<String, String, String> hashes = redis.opsForHash();

      int previousCount = parseCount(hashes.get(key, MESSAGE_COUNT));
      List<Message> messages = conversation.messages();

      Map<String, String> fields = new LinkedHashMap<>();
      fields.put(ID, id);
      fields.put(TITLE, conversation.title() == null ? "" : conversation.title());
      fields.put(CREATED_AT, conversation.createdAt().toString());
      fields.put(UPDATED_AT, conversation.updatedAt().toString());
      fields.put(CREATED_AT_MS, String.valueOf(conversation.createdAt().toEpochMilli()));
      fields.put(UPDATED_AT_MS, String.valueOf(conversation.updatedAt().toEpochMilli()));
      fields.put(MESSAGE_COUNT, String.valueOf(messages.size()));
      fields.put(CONTENT, searchableContent(messages));
      fields.put(DATA, mapper.writeValueAsString(conversation));
      hashes.putAll(key, fields);

      for (int i = 0; i < messages.size(); i++) {
        Message message = messages.get(i);
        String messageKey = messageKey(id, i);
        Map<String, String> messageFields = new LinkedHashMap<>();
        messageFields.put("conversation_id", id);
        messageFields.put("message_index", String.valueOf(i));
        messageFields.put(ID, message.id());
        messageFields.put("role", message.role().value());
        messageFields.put(CONTENT, message.content());
        messageFields.put("timestamp", message.timestamp().toString());
        messageFields.put("metadata", mapper.writeValueAsString(message.metadata()));
        hashes.putAll(messageKey, messageFields);
        redis.expire(messageKey, ttl);
      }
      if (previousCount > messages.size()) {
        deleteMessageKeys(id, messages.size(), previousCount);
      }

      redis.opsForSet().add(CONVERSATIONS_SET, id);
      redis.expire(key, ttl);

      log.debug("Saved conversation {} to Redis", id);
      return true;
    } catch (Exception e) {
      log.error("Error saving conversation {} to Redis", conversation.id(), e);
      return false;
    }
  }

  @Override
  public Optional<Conversation> load(String conversationId) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot load conversation {}", conversationId);
      return Optional.empty();
    }
    if (!ConversationStore.isValidId(conversationId)) {
      log.warn("Invalid conversation id '{}'", conversationId);
      return Optional.empty();
    }

    try {
      HashOperations<String, String, String> hashes = redis.opsForHash();
      String data = hashes.get(conversationKey(conversationId), DATA);
      if (data == null || data.isBlank()) {
        log.warn("Conversation {} not found in Redis", conversationId);
        return Optional.empty();
      }
      Conversation conversation = parse(data);
      log.debug("Loaded conversation {} from Redis", conversationId);
      return Optional.of(conversation);
    } catch (Exception e) {
      log.error("Error loading conversation {} from Redis", conversationId, e);
      return Optional.empty();
    }
  }

  @Override
  public boolean delete(String conversationId) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot delete conversation {}", conversationId);
      return false;
    }
    if (!ConversationStore.isValidId(conversationId)) {
      return false;
    }

    try {
      boolean deleted = remove(conversationId);
      if (deleted) {
        log.info("Deleted conversation {} from Redis", conversationId);
      } else {
        log.warn("Conversation {} not found in Redis", conversationId);
      }
      return deleted;
    } catch (Exception e) {
      log.error("Error deleting conversation {} from Redis", conversationId, e);
      return false;
    }
  }

  @Override
  public List<ConversationSummary> list(int limit, int offset) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot list conversations");
      return List.of();
    }

    try {
      HashOperations<String, String, String> hashes = redis.opsForHash();
      List<ConversationSummary> summaries = new ArrayList<>();
      List<String> expired = new ArrayList<>();
      for (String id : knownIds()) {
        List<String> values = hashes.multiGet(conversationKey(id), SUMMARY_FIELDS);
        if (values == null || values.isEmpty() || values.get(0) == null) {
          expired.add(id);
          continue;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < SUMMARY_FIELDS.size() && i < values.size(); i++) {
          fields.put(SUMMARY_FIELDS.get(i), values.get(i));
        }
        try {
          summaries.add(summaryFrom(fields));
        } catch (ConversationParseException e) {
          log.warn("Skipping conversation {}: {}", id, e.getMessage());
        }
      }
      pruneExpired(expired);

      summaries.sort(ConversationSummary.MOST_RECENT_FIRST);
      return StoreSupport.page(summaries, limit, offset);
    } catch (Exception e) {
      log.error("Error listing conversations from Redis", e);
      return List.of();
    }
  }

  @Override
  public List<ConversationSummary> search(String query, int limit) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot search conversations");
      return List.of();
    }
    if (query == null || query.isBlank()) {
      return List.of();
    }

    if (searchIndex.isAvailable()) {
      try {
        return searchIndex.search(query, limit);
      } catch (Exception e) {
        log.warn("Indexed search failed, falling back to manual scan: {}", e.getMessage());
      }
    }
    return manualSearch(query, limit);
  }

  private List<ConversationSummary> manualSearch(String query, int limit) {
    try {
      String needle = query.toLowerCase(Locale.ROOT);
      HashOperations<String, String, String> hashes = redis.opsForHash();
      List<ConversationSummary> matches = new ArrayList<>();
      List<String> expired = new ArrayList<>();
      for (String id : knownIds()) {
        String data = hashes.get(conversationKey(id), DATA);
        if (data == null) {
          expired.add(id);
          continue;
        }
        try {
          Conversation conversation = parse(data);
          if (StoreSupport.matches(conversation, needle)) {
            matches.add(conversation.summary());
          }
        } catch (ConversationParseException e) {
          log.warn("Skipping conversation {} during search: {}", id, e.getMessage());
        }
      }
      pruneExpired(expired);

      matches.sort(ConversationSummary.MOST_RECENT_FIRST);
      return StoreSupport.page(matches, limit, 0);
    } catch (Exception e) {
      log.error("Error in manual search", e);
      return List.of();
    }
  }

  @Override
  public Map<String, Object> stats() {
    if (!isConnected()) {
      log.error("Redis not connected, cannot read storage stats");
      return Map.of();
    }

    try {
      Long total = redis.opsForSet().size(CONVERSATIONS_SET);
      Properties memory = info("memory");
      Properties clients = info("clients");
      Properties server = info("server");

      Map<String, Object> stats = new LinkedHashMap<>();
      stats.put("backend", name());
      stats.put("total_conversations", total == null ? 0L : total);
      stats.put("search_index_available", searchIndex.isAvailable());
      stats.put("redis_memory_used", memory.getProperty("used_memory_human", "Unknown"));
      stats.put("redis_connected_clients", clients.getProperty("connected_clients", "0"));
      stats.put("redis_version", server.getProperty("redis_version", "Unknown"));
      return stats;
    } catch (Exception e) {
      log.error("Error getting conversation stats", e);
      return Map.of();
    }
  }

  @Override
  public int cleanup(int days) {
    if (!isConnected()) {
      log.error("Redis not connected, cannot clean up conversations");
      return 0;
    }

    try {
      Instant cutoff = clock.instant().minus(Duration.ofDays(days));
      HashOperations<String, String, String> hashes = redis.opsForHash();
      List<String> expired = new ArrayList<>();
      int deleted = 0;
      for (String id : knownIds()) {
        String updatedAt = hashes.get(conversationKey(id), UPDATED_AT);
        if (updatedAt == null) {
          expired.add(id);
          continue;
        }
        try {
          if (Instant.parse(updatedAt).isBefore(cutoff) && remove(id)) {
            deleted++;
          }
        } catch (DateTimeParseException e) {
          log.warn("Skipping conversation {} with invalid timestamp '{}'", id, updatedAt);
        }
      }
      pruneExpired(expired);

      log.info("Cleaned up {} old conversations", deleted);
      return deleted;
    } catch (Exception e) {
      log.error("Error cleaning up old conversations", e);
      return 0;
    }
  }

  @Override
  public String name() {
    return "redis";
  }

  private boolean remove(String conversationId) {
    String key = conversationKey(conversationId);
    HashOperations<String, String, String> hashes = redis.opsForHash();
    int count = parseCount(hashes.get(key, MESSAGE_COUNT));
    deleteMessageKeys(conversationId, 0, count);
    Boolean deleted = redis.delete(key);
    redis.opsForSet().remove(CONVERSATIONS_SET, conversationId);
    return Boolean.TRUE.equals(deleted);
  }

  private void deleteMessageKeys(String conversationId, int from, int to) {
    if (to <= from) {
      return;
    }
    List<String> keys = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      keys.add(messageKey(conversationId, i));
    }
    redis.delete(keys);
  }

  private Set<String> knownIds() {
    Set<String> ids = redis.opsForSet().members(CONVERSATIONS_SET);
    return ids == null ? Set.of() : ids;
  }

  private void pruneExpired(List<String> expired) {
    if (expired.isEmpty()) {
      return;
    }
    redis.opsForSet().remove(CONVERSATIONS_SET, expired.toArray());
    log.debug("Pruned {} expired ids from the conversation set", expired.size());
  }

  private Properties info(String section) {
    Properties properties =
        redis.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info(section));
    return properties == null ? new Properties() : properties;
  }

  private Conversation parse(String data) {
    Conversation conversation;
    try {
      conversation = mapper.readValue(data, Conversation.class);
    } catch (JsonProcessingException e) {
      throw new ConversationParseException("Malformed conversation body", e);
    }
    if (conversation == null || conversation.id() == null || conversation.updatedAt() == null) {
      throw new ConversationParseException("Incomplete conversation body");
    }
    return conversation;
  }

  private String searchableContent(List<Message> messages) {
    StringBuilder content = new StringBuilder();
    for (Message message : messages) {
      if (content.length() > 0) {
        content.append(' ');
      }
      content.append(message.content());
      if (content.length() >= contentLimit) {
        break;
      }
    }
    return content.length() > contentLimit ? content.substring(0, contentLimit) : content.toString();
  }

  static ConversationSummary summaryFrom(Map<String, String> fields) {
    String id = fields.get(ID);
    if (id == null || id.isBlank()) {
      throw new ConversationParseException("Summary without id");
    }
    try {
      return new ConversationSummary(
          id,
          fields.getOrDefault(TITLE, ""),
          parseCount(fields.get(MESSAGE_COUNT)),
          fields.get(CREATED_AT) == null ? null : Instant.parse(fields.get(CREATED_AT)),
          fields.get(UPDATED_AT) == null ? null : Instant.parse(fields.get(UPDATED_AT)));
    } catch (DateTimeParseException e) {
      throw new ConversationParseException("Invalid timestamp in summary of " + id, e);
    }
  }

  private static int parseCount(String value) {
    if (value == null || value.isBlank()) {
      return 0;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  static String conversationKey(String conversationId) {
    return CONVERSATION_KEY_PREFIX + conversationId;
  }

  static String messageKey(String conversationId, int index) {
    return MESSAGE_KEY_PREFIX + conversationId + ":" + index;
  }
}
