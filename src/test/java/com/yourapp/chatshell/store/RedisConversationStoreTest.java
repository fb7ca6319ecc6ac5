package com.yourapp.chatshell.store;

import static com.yourapp.chatshell.TestFixtures.NOW;
import static com.yourapp.chatshell.TestFixtures.conversation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourapp.chatshell.TestFixtures;
import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import com.yourapp.chatshell.model.Message;
import com.yourapp.chatshell.model.MessageRole;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(OutputCaptureExtension.class)
class RedisConversationStoreTest {

  private static final Duration TTL = Duration.ofDays(30);

  private final ObjectMapper mapper = TestFixtures.mapper();
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  private InMemoryRedis redis;
  private RedisConversationStore store;

  @BeforeEach
  void setUp() {
    redis = new InMemoryRedis();
    store = newStore(ConversationSearchIndex.unavailable());
  }

  private RedisConversationStore newStore(ConversationSearchIndex index) {
    return new RedisConversationStore(redis.template, mapper, index, TTL, 5000, clock);
  }

  @Test
  void savedConversationLoadsBackEqual() {
    Message question = new Message("m1", MessageRole.USER, "What is a dividend?",
        NOW.minusSeconds(5), Map.of("source", "cli", "turn", 1));
    Message answer = new Message("m2", MessageRole.ASSISTANT, "A share of profits.",
        NOW, Map.of());
    Conversation original = new Conversation("c1", "Dividend Basics", List.of(question, answer),
        NOW.minusSeconds(60), NOW, Map.of("pinned", true));

    assertThat(store.save(original)).isTrue();

    assertThat(store.load("c1")).contains(original);
  }

  @Test
  void saveWritesSummaryHashMessageHashesAndIdSet() {
    store.save(conversation("c1", "Dividend Basics", NOW, "What is a dividend?", "A share of profits."));

    Map<String, String> hash = redis.hashes.get("conversation:c1");
    assertThat(hash)
        .containsEntry("id", "c1")
        .containsEntry("title", "Dividend Basics")
        .containsEntry("updated_at", NOW.toString())
        .containsEntry("updated_at_ms", String.valueOf(NOW.toEpochMilli()))
        .containsEntry("message_count", "2")
        .containsEntry("content", "What is a dividend? A share of profits.")
        .containsKey("data");
    assertThat(redis.hashes.get("message:c1:0"))
        .containsEntry("conversation_id", "c1")
        .containsEntry("message_index", "0")
        .containsEntry("role", "user")
        .containsEntry("content", "What is a dividend?");
    assertThat(redis.hashes.get("message:c1:1")).containsEntry("role", "assistant");
    assertThat(redis.sets.get("conversations")).containsExactly("c1");
  }

  @Test
  void everySaveRefreshesExpiryOnConversationAndMessageKeys() {
    Conversation conversation = conversation("c1", "Budget", NOW, "hello");
    store.save(conversation);
    redis.ttls.clear();

    store.save(conversation);

    assertThat(redis.ttls)
        .containsEntry("conversation:c1", TTL)
        .containsEntry("message:c1:0", TTL);
  }

  @Test
  void searchableContentIsCappedAtConfiguredLimit() {
    RedisConversationStore capped =
        new RedisConversationStore(redis.template, mapper, ConversationSearchIndex.unavailable(), TTL, 10, clock);

    capped.save(conversation("c1", "Long", NOW, "abcdefgh", "ijklmnop"));

    assertThat(redis.hashes.get("conversation:c1").get("content")).isEqualTo("abcdefgh i");
  }

  @Test
  void shorterSaveRemovesStaleMessageKeys() {
    store.save(conversation("c1", "Budget", NOW, "one", "two", "three"));

    store.save(conversation("c1", "Budget", NOW, "one"));

    assertThat(redis.keys()).contains("message:c1:0").doesNotContain("message:c1:1", "message:c1:2");
  }

  @Test
  void invalidIdIsRejected() {
    assertThat(store.save(conversation("../etc", "Bad", NOW, "hi"))).isFalse();
    assertThat(store.load("../etc")).isEmpty();
    assertThat(store.delete("a b")).isFalse();
    assertThat(redis.keys()).isEmpty();
  }

  @Test
  void listIsMostRecentFirstAndPaged() {
    for (int i = 1; i <= 5; i++) {
      store.save(conversation("c" + i, "Conversation " + i, NOW.minusSeconds(600L - i * 60L), "hi " + i));
    }

    List<ConversationSummary> page = store.list(2, 1);

    assertThat(page).extracting(ConversationSummary::id).containsExactly("c4", "c3");
    assertThat(store.list(50, 0)).extracting(ConversationSummary::id)
        .containsExactly("c5", "c4", "c3", "c2", "c1");
    assertThat(store.list(50, 10)).isEmpty();
  }

  @Test
  void softExpiredConversationsAreSkippedAndPrunedFromIdSet() {
    store.save(conversation("c1", "Old", NOW.minusSeconds(120), "hi"));
    store.save(conversation("c2", "New", NOW, "hello"));
    redis.expireNow("conversation:c1");

    assertThat(store.list(50, 0)).extracting(ConversationSummary::id).containsExactly("c2");
    assertThat(redis.sets.get("conversations")).containsExactly("c2");
    assertThat(store.load("c1")).isEmpty();
  }

  @Test
  void deleteReturnsTrueOnlyWhenRecordExisted() {
    store.save(conversation("c1", "Budget", NOW, "one", "two"));

    assertThat(store.delete("c1")).isTrue();
    assertThat(store.delete("c1")).isFalse();
    assertThat(redis.keys()).isEmpty();
    assertThat(redis.sets.getOrDefault("conversations", Set.of())).isEmpty();
  }

  @Test
  void manualSearchMatchesTitleOrContentIgnoringCase() {
    store.save(conversation("c1", "Dividend Basics", NOW.minusSeconds(60), "What is a dividend?"));
    store.save(conversation("c2", "Groceries", NOW, "Remind me about DIVIDEND dates"));
    store.save(conversation("c3", "Weather", NOW, "Is it raining?"));

    assertThat(store.search("dividend", 20)).extracting(ConversationSummary::id)
        .containsExactly("c2", "c1");
    assertThat(store.search("basics", 20)).extracting(ConversationSummary::id).containsExactly("c1");
    assertThat(store.search("stocks", 20)).isEmpty();
    assertThat(store.search("  ", 20)).isEmpty();
  }

  @Test
  void indexedSearchAgreesWithManualScan() {
    store.save(conversation("c1", "Dividend Basics", NOW.minusSeconds(60), "What is a dividend?"));
    store.save(conversation("c2", "Groceries", NOW, "Remind me about dividend dates"));
    store.save(conversation("c3", "Weather", NOW.minusSeconds(30), "Is it raining?"));
    redis.withModules(RespReplies.decoded(List.of(List.of("name", "search", "ver", 21005L))));
    redis.onCommand((command, args) ->
        command.equals("FT.SEARCH") ? RespReplies.decoded(searchReply("dividend")) : "OK");

    RedisConversationStore indexed = newStore(new RediSearchIndex(redis.template));

    assertThat(indexed.stats()).containsEntry("search_index_available", true);
    assertThat(indexed.search("dividend", 20))
        .extracting(ConversationSummary::id)
        .containsExactly("c2", "c1");
    assertThat(indexed.search("dividend", 20)).isEqualTo(store.search("dividend", 20));
    assertThat(redis.commands).anyMatch(command -> command.startsWith("FT.SEARCH"));
  }

  @Test
  void nonArraySearchReplyFallsBackToManualScan() {
    store.save(conversation("c1", "Dividend Basics", NOW, "explain dividend in stock market"));
    redis.withModules(RespReplies.decoded(List.of(List.of("name", "search", "ver", 21005L))));
    redis.onCommand((command, args) ->
        command.equals("FT.SEARCH") ? bytes("Dividend Basics") : "OK");

    RedisConversationStore indexed = newStore(new RediSearchIndex(redis.template));

    assertThat(indexed.search("dividend", 20)).extracting(ConversationSummary::id).containsExactly("c1");
  }

  @Test
  void failingIndexFallsBackToManualScan() {
    ConversationSearchIndex index = mock(ConversationSearchIndex.class);
    when(index.isAvailable()).thenReturn(true);
    when(index.search(anyString(), anyInt())).thenThrow(new QueryTimeoutException("search timed out"));
    RedisConversationStore indexed = newStore(index);
    indexed.save(conversation("c1", "Dividend Basics", NOW, "What is a dividend?"));

    assertThat(indexed.search("dividend", 20)).extracting(ConversationSummary::id).containsExactly("c1");
  }

  @Test
  void cleanupRemovesStaleConversationsAndIsIdempotent() {
    store.save(conversation("old", "Old", NOW.minus(Duration.ofDays(40)), "hi"));
    store.save(conversation("recent", "Recent", NOW.minus(Duration.ofDays(10)), "hi"));

    assertThat(store.cleanup(30)).isEqualTo(1);
    assertThat(store.cleanup(30)).isZero();
    assertThat(store.list(50, 0)).extracting(ConversationSummary::id).containsExactly("recent");
    assertThat(redis.keys()).noneMatch(key -> key.contains("old"));
  }

  @Test
  void statsDescribeServerAndCollection() {
    store.save(conversation("c1", "Budget", NOW, "hi"));

    assertThat(store.stats())
        .containsEntry("backend", "redis")
        .containsEntry("total_conversations", 1L)
        .containsEntry("search_index_available", false)
        .containsEntry("redis_memory_used", "1.00M")
        .containsEntry("redis_connected_clients", "1")
        .containsEntry("redis_version", "7.2.4");
  }

  @Test
  void unreachableServerYieldsFailureValues() {
    store.save(conversation("c1", "Budget", NOW, "hi"));
    redis.goDown();

    assertThat(store.isConnected()).isFalse();
    assertThat(store.save(conversation("c2", "Other", NOW, "hi"))).isFalse();
    assertThat(store.load("c1")).isEmpty();
    assertThat(store.delete("c1")).isFalse();
    assertThat(store.list(50, 0)).isEmpty();
    assertThat(store.search("budget", 20)).isEmpty();
    assertThat(store.stats()).isEmpty();
    assertThat(store.cleanup(0)).isZero();

    redis.comeUp();
    assertThat(store.load("c1")).isPresent();
  }

  @Test
  void failedProbeIsLoggedForStatsAndCleanup(CapturedOutput output) {
    redis.goDown();

    assertThat(store.stats()).isEmpty();
    assertThat(store.cleanup(30)).isZero();

    assertThat(output.getAll())
        .contains("Redis not connected, cannot read storage stats")
        .contains("Redis not connected, cannot clean up conversations");
  }

  @Test
  void constructionFailsWhenServerIsUnreachable() {
    redis.goDown();

    assertThrows(StoreConnectionException.class, () -> newStore(ConversationSearchIndex.unavailable()));
  }

  @Test
  void corruptBodyIsSkippedBySearch() {
    store.save(conversation("c1", "Dividend Basics", NOW, "hi"));
    store.save(conversation("c2", "Dividend Plans", NOW, "hi"));
    redis.hashes.get("conversation:c2").put("data", "{not json");

    assertThat(store.search("dividend", 20)).extracting(ConversationSummary::id).containsExactly("c1");
    assertThat(store.load("c2")).isEmpty();
  }

  /** Builds an FT.SEARCH reply the way RediSearch returns it, from the stored hashes. */
  private List<Object> searchReply(String needle) {
    List<Map<String, String>> hits = new ArrayList<>();
    redis.hashes.forEach((key, hash) -> {
      if (key.startsWith("conversation:")
          && (hash.get("title").toLowerCase(Locale.ROOT).contains(needle)
              || hash.get("content").toLowerCase(Locale.ROOT).contains(needle))) {
        hits.add(hash);
      }
    });
    hits.sort(Comparator.comparingLong((Map<String, String> hash) -> Long.parseLong(hash.get("updated_at_ms")))
        .reversed());

    List<Object> reply = new ArrayList<>();
    reply.add((long) hits.size());
    for (Map<String, String> hash : hits) {
      reply.add(bytes("conversation:" + hash.get("id")));
      List<Object> fields = new ArrayList<>();
      for (String field : List.of("id", "title", "created_at", "updated_at", "message_count")) {
        fields.add(bytes(field));
        fields.add(bytes(hash.get(field)));
      }
      reply.add(fields);
    }
    return reply;
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
