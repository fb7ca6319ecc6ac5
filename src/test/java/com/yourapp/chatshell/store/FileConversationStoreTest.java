package com.yourapp.chatshell.store;

import static com.yourapp.chatshell.TestFixtures.NOW;
import static com.yourapp.chatshell.TestFixtures.conversation;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourapp.chatshell.TestFixtures;
import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import com.yourapp.chatshell.model.Message;
import com.yourapp.chatshell.model.MessageRole;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileConversationStoreTest {

  @TempDir
  Path tempDir;

  private final ObjectMapper mapper = TestFixtures.mapper();
  private FileConversationStore store;

  @BeforeEach
  void setUp() {
    store = new FileConversationStore(tempDir.resolve("conversations"), mapper,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createsDirectoryOnConstruction() {
    assertThat(tempDir.resolve("conversations")).isDirectory();
  }

  @Test
  void savedConversationLoadsBackEqual() {
    Message question = new Message("m1", MessageRole.USER, "What is a dividend?",
        NOW.minusSeconds(5), Map.of("source", "cli"));
    Message answer = new Message("m2", MessageRole.ASSISTANT, "A share of profits.", NOW, Map.of());
    Conversation original = new Conversation("c1", "Dividend Basics", List.of(question, answer),
        NOW.minusSeconds(60), NOW, Map.of());

    assertThat(store.save(original)).isTrue();

    assertThat(store.load("c1")).contains(original);
  }

  @Test
  void writesVersionedDocumentPerConversation() throws Exception {
    store.save(conversation("c1", "Budget", NOW, "hello"));

    Path file = store.file("c1");
    assertThat(file.getFileName().toString()).isEqualTo("conversation_c1.json");
    JsonNode document = mapper.readTree(file.toFile());
    assertThat(document.path("version").asText()).isEqualTo("1.0");
    assertThat(document.path("export_timestamp").asText()).isEqualTo(NOW.toString());
    assertThat(document.path("conversation").path("id").asText()).isEqualTo("c1");
    assertThat(document.path("conversation").path("updated_at").asText()).isEqualTo(NOW.toString());
    assertThat(document.path("conversation").path("messages").get(0).path("role").asText())
        .isEqualTo("user");
  }

  @Test
  void saveOverwritesPreviousState() {
    store.save(conversation("c1", "Budget", NOW.minusSeconds(60), "one", "two"));
    store.save(conversation("c1", "Budget v2", NOW, "one"));

    Conversation loaded = store.load("c1").orElseThrow();
    assertThat(loaded.title()).isEqualTo("Budget v2");
    assertThat(loaded.messages()).hasSize(1);
  }

  @Test
  void missingAndInvalidIdsLoadNothing() {
    assertThat(store.load("nope")).isEmpty();
    assertThat(store.load("../secrets")).isEmpty();
    assertThat(store.save(conversation("../secrets", "Bad", NOW, "hi"))).isFalse();
  }

  @Test
  void deleteReturnsTrueOnlyWhenFileExisted() {
    store.save(conversation("c1", "Budget", NOW, "hello"));

    assertThat(store.delete("c1")).isTrue();
    assertThat(store.delete("c1")).isFalse();
    assertThat(store.file("c1")).doesNotExist();
  }

  @Test
  void listIsMostRecentFirstAndPaged() {
    for (int i = 1; i <= 5; i++) {
      store.save(conversation("c" + i, "Conversation " + i, NOW.minusSeconds(600L - i * 60L), "hi"));
    }

    assertThat(store.list(2, 1)).extracting(ConversationSummary::id).containsExactly("c4", "c3");
    assertThat(store.list(50, 0)).extracting(ConversationSummary::messageCount).containsOnly(1);
    assertThat(store.list(50, 5)).isEmpty();
  }

  @Test
  void unreadableDocumentsAreSkipped() throws Exception {
    store.save(conversation("c1", "Dividend Basics", NOW.minus(Duration.ofDays(40)), "hello"));
    Files.writeString(tempDir.resolve("conversations").resolve("conversation_broken.json"),
        "{not json", StandardCharsets.UTF_8);

    assertThat(store.list(50, 0)).extracting(ConversationSummary::id).containsExactly("c1");
    assertThat(store.search("dividend", 20)).extracting(ConversationSummary::id).containsExactly("c1");
    assertThat(store.cleanup(30)).isEqualTo(1);
    assertThat(tempDir.resolve("conversations").resolve("conversation_broken.json")).exists();
  }

  @Test
  void searchMatchesTitleOrContentIgnoringCase() {
    store.save(conversation("c1", "Dividend Basics", NOW.minusSeconds(60), "What is a dividend?"));
    store.save(conversation("c2", "Groceries", NOW, "Remind me about DIVIDEND dates"));
    store.save(conversation("c3", "Weather", NOW, "Is it raining?"));

    assertThat(store.search("Dividend", 20)).extracting(ConversationSummary::id)
        .containsExactly("c2", "c1");
    assertThat(store.search("dividend", 1)).extracting(ConversationSummary::id).containsExactly("c2");
    assertThat(store.search("", 20)).isEmpty();
  }

  @Test
  void cleanupIsIdempotent() {
    store.save(conversation("old", "Old", NOW.minus(Duration.ofDays(40)), "hi"));
    store.save(conversation("recent", "Recent", NOW.minus(Duration.ofDays(10)), "hi"));

    assertThat(store.cleanup(30)).isEqualTo(1);
    assertThat(store.cleanup(30)).isZero();
    assertThat(store.list(50, 0)).extracting(ConversationSummary::id).containsExactly("recent");
  }

  @Test
  void statsCountFilesAndBytes() throws Exception {
    store.save(conversation("c1", "Budget", NOW, "hello"));
    store.save(conversation("c2", "Trip", NOW, "hello"));
    long bytes = Files.size(store.file("c1")) + Files.size(store.file("c2"));

    Map<String, Object> stats = store.stats();

    assertThat(stats)
        .containsEntry("backend", "file")
        .containsEntry("total_conversations", 2)
        .containsEntry("storage_size_bytes", bytes)
        .containsKey("storage_size_mb")
        .containsEntry("storage_directory", tempDir.resolve("conversations").toString());
  }
}
