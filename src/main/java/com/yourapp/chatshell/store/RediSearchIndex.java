package com.yourapp.chatshell.store;

import com.yourapp.chatshell.model.ConversationSummary;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.output.NestedMultiOutput;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.DecoratedRedisConnection;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.lettuce.LettuceConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Weighted full-text index over conversation hashes, backed by the RediSearch module.
 *
 * <p>The index covers every hash under {@code conversation:}; titles weigh twice as much as
 * message content. Results are sorted on the numeric {@code updated_at_ms} field.
 */
public class RediSearchIndex implements ConversationSearchIndex {

  private static final Logger log = LoggerFactory.getLogger(RediSearchIndex.class);

  static final String INDEX_NAME = "conversations_idx";
  private static final String SPECIAL_CHARACTERS = ",.<>{}[]\"':;!@#$%^&*()-+=~|/\\?`";

  private final StringRedisTemplate redis;
  private volatile boolean available;

  public RediSearchIndex(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public void initialize() {
    try {
      Object modules = command("MODULE", "LIST");
      if (!hasSearchModule(modules)) {
        log.warn("RediSearch module not available - search will scan every conversation");
        available = false;
        return;
      }
      available = true;
      createIndex();
    } catch (DataAccessException e) {
      log.warn("Could not initialize search index: {}", e.getMessage());
      available = false;
    }
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public List<ConversationSummary> search(String query, int limit) {
    String escaped = escape(query);
    String expression = "@title:(" + escaped + ") | @content:(" + escaped + ")";
    Object reply = command(
        "FT.SEARCH", INDEX_NAME, expression,
        "RETURN", "5",
        RedisConversationStore.ID,
        RedisConversationStore.TITLE,
        RedisConversationStore.CREATED_AT,
        RedisConversationStore.UPDATED_AT,
        RedisConversationStore.MESSAGE_COUNT,
        "SORTBY", RedisConversationStore.UPDATED_AT_MS, "DESC",
        "LIMIT", "0", String.valueOf(Math.max(limit, 0)));
    return parseSearchReply(reply);
  }

  private void createIndex() {
    try {
      command(
          "FT.CREATE", INDEX_NAME,
          "ON", "HASH",
          "PREFIX", "1", RedisConversationStore.CONVERSATION_KEY_PREFIX,
          "SCHEMA",
          RedisConversationStore.TITLE, "TEXT", "WEIGHT", "2.0",
          RedisConversationStore.CONTENT, "TEXT", "WEIGHT", "1.0",
          RedisConversationStore.CREATED_AT_MS, "NUMERIC", "SORTABLE",
          RedisConversationStore.UPDATED_AT_MS, "NUMERIC", "SORTABLE",
          RedisConversationStore.MESSAGE_COUNT, "NUMERIC", "SORTABLE");
      log.info("Created Redis search index {}", INDEX_NAME);
    } catch (DataAccessException e) {
      String reason = String.valueOf(e.getMostSpecificCause().getMessage());
      if (reason.toLowerCase(Locale.ROOT).contains("index already exists")) {
        log.debug("Search index {} already exists", INDEX_NAME);
      } else {
        log.warn("Could not create search index: {}", reason);
      }
    }
  }

  /**
   * Sends a module command. Lettuce decodes replies of commands it does not know into a single bulk
   * string, so its connection is handed an output that keeps nested arrays and integers.
   */
  private Object command(String command, String... args) {
    byte[][] raw = new byte[args.length][];
    for (int i = 0; i < args.length; i++) {
      raw[i] = args[i].getBytes(StandardCharsets.UTF_8);
    }
    return redis.execute((RedisCallback<Object>) connection -> {
      RedisConnection target = connection;
      while (target instanceof DecoratedRedisConnection decorated) {
        target = decorated.getDelegate();
      }
      if (target instanceof LettuceConnection lettuce) {
        return lettuce.execute(command, replyOutput(), raw);
      }
      return connection.execute(command, raw);
    }, true);
  }

  static CommandOutput<byte[], byte[], List<Object>> replyOutput() {
    return new NestedMultiOutput<>(ByteArrayCodec.INSTANCE);
  }

  static boolean hasSearchModule(Object reply) {
    if (reply instanceof List<?> items) {
      for (Object item : items) {
        if (hasSearchModule(item)) {
          return true;
        }
      }
      return false;
    }
    String text = text(reply);
    return text != null && text.toLowerCase(Locale.ROOT).contains("search");
  }

  /**
   * Reads an {@code FT.SEARCH} reply: the total count followed by alternating document keys and
   * flat field/value lists.
   *
   * @throws ConversationParseException when the reply is not an array
   */
  static List<ConversationSummary> parseSearchReply(Object reply) {
    if (!(reply instanceof List<?> items) || items.isEmpty()) {
      throw new ConversationParseException("Unexpected search reply: " + text(reply));
    }
    List<ConversationSummary> summaries = new ArrayList<>();
    for (int i = 1; i + 1 < items.size(); i += 2) {
      if (!(items.get(i + 1) instanceof List<?> pairs)) {
        continue;
      }
      Map<String, String> fields = new LinkedHashMap<>();
      for (int j = 0; j + 1 < pairs.size(); j += 2) {
        fields.put(text(pairs.get(j)), text(pairs.get(j + 1)));
      }
      try {
        summaries.add(RedisConversationStore.summaryFrom(fields));
      } catch (ConversationParseException e) {
        log.warn("Skipping malformed search hit {}: {}", text(items.get(i)), e.getMessage());
      }
    }
    return summaries;
  }

  static String escape(String query) {
    StringBuilder escaped = new StringBuilder(query.length() + 8);
    for (char c : query.trim().toCharArray()) {
      if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private static String text(Object value) {
    if (value instanceof byte[] bytes) {
      return new String(bytes, StandardCharsets.UTF_8);
    }
    return value == null ? null : value.toString();
  }
}
