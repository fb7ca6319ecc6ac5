package com.yourapp.chatshell.conversation;

import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import com.yourapp.chatshell.model.Message;
import com.yourapp.chatshell.model.MessageRole;
import com.yourapp.chatshell.store.ConversationStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything the shell does with conversations. Owns id and timestamp generation
 * and keeps the conversations touched in this session in memory; every mutation is written through
 * to the store before the call returns.
 */
@Service
public class ConversationManager {

  private static final Logger log = LoggerFactory.getLogger(ConversationManager.class);

  private static final DateTimeFormatter TITLE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

  private final ConversationStore store;
  private final Clock clock;
  private final int maxContextMessages;
  private final ConcurrentMap<String, Conversation> conversations = new ConcurrentHashMap<>();

  public ConversationManager(
      ConversationStore store,
      Clock clock,
      @Value("${app.conversation.max-context-messages:10}") int maxContextMessages) {
    this.store = store;
    this.clock = clock;
    this.maxContextMessages = maxContextMessages;
    log.info("Using {} storage for conversations", store.name());
  }

  public String createConversation(String title) {
    String conversationId = UUID.randomUUID().toString();
    Instant now = now();
    String resolvedTitle =
        title == null || title.isBlank() ? "Conversation " + TITLE_FORMAT.format(now) : title.trim();

    Conversation conversation = Conversation.create(conversationId, resolvedTitle, now);
    conversations.put(conversationId, conversation);
    persist(conversation);

    log.info("Created new conversation: {}", conversationId);
    return conversationId;
  }

  public String addMessage(String conversationId, MessageRole role, String content) {
    return addMessage(conversationId, role, content, Map.of());
  }

  /**
   * Appends a message and persists the updated conversation.
   *
   * @throws ConversationNotFoundException when neither this session nor the store knows the id
   */
  public String addMessage(
      String conversationId, MessageRole role, String content, Map<String, Object> metadata) {
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("Message content must not be empty");
    }
    Conversation conversation = resolve(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));

    Message message =
        new Message(UUID.randomUUID().toString(), role, content, now(), metadata);
    Conversation updated = conversation.withMessage(message);
    conversations.put(conversationId, updated);
    persist(updated);

    log.debug("Added {} message to conversation {}", role.value(), conversationId);
    return message.id();
  }

  public Optional<Conversation> getConversation(String conversationId) {
    return resolve(conversationId);
  }

  public List<Message> getMessages(String conversationId) {
    return resolve(conversationId).map(Conversation::messages).orElse(List.of());
  }

  public List<ContextMessage> getContext(String conversationId) {
    return getContext(conversationId, maxContextMessages);
  }

  public List<ContextMessage> getContext(String conversationId, int maxMessages) {
    return ContextWindow.of(getMessages(conversationId), maxMessages);
  }

  /** Re-reads a conversation from the store, replacing any in-memory copy. */
  public boolean loadConversation(String conversationId) {
    Optional<Conversation> loaded = store.load(conversationId);
    loaded.ifPresent(conversation -> {
      conversations.put(conversation.id(), conversation);
      log.info("Loaded conversation: {}", conversationId);
    });
    return loaded.isPresent();
  }

  public boolean saveConversation(String conversationId) {
    Conversation conversation = conversationId == null ? null : conversations.get(conversationId);
    if (conversation == null) {
      return false;
    }
    return persist(conversation);
  }

  public List<ConversationSummary> listConversations(int limit, int offset) {
    return store.list(limit, offset);
  }

  public List<ConversationSummary> searchConversations(String query, int limit) {
    return store.search(query, limit);
  }

  public boolean deleteConversation(String conversationId) {
    boolean deleted = store.delete(conversationId);
    if (deleted) {
      conversations.remove(conversationId);
      log.info("Deleted conversation: {}", conversationId);
    } else {
      log.warn("Conversation {} was not deleted", conversationId);
    }
    return deleted;
  }

  public int cleanupOldConversations(int days) {
    Instant cutoff = now().minus(Duration.ofDays(days));
    conversations.values().removeIf(conversation -> conversation.updatedAt().isBefore(cutoff));
    return store.cleanup(days);
  }

  public Map<String, Object> storageStats() {
    return store.stats();
  }

  public String backendName() {
    return store.name();
  }

  public String conversationSummary(String conversationId) {
    Optional<Conversation> found = resolve(conversationId);
    if (found.isEmpty()) {
      return "Conversation not found";
    }
    Conversation conversation = found.get();
    List<Message> messages = conversation.messages();
    if (messages.isEmpty()) {
      return "Empty conversation created at " + conversation.createdAt();
    }
    Instant lastActivity = messages.get(messages.size() - 1).timestamp();
    return conversation.title() + " - " + messages.size() + " messages, last activity: " + lastActivity;
  }

  private Optional<Conversation> resolve(String conversationId) {
    if (conversationId == null) {
      return Optional.empty();
    }
    Conversation hot = conversations.get(conversationId);
    if (hot != null) {
      return Optional.of(hot);
    }
    Optional<Conversation> loaded = store.load(conversationId);
    loaded.ifPresent(conversation -> conversations.put(conversationId, conversation));
    return loaded;
  }

  private boolean persist(Conversation conversation) {
    boolean saved = store.save(conversation);
    if (!saved) {
      log.warn("Conversation {} could not be persisted to {} storage",
          conversation.id(), store.name());
    }
    return saved;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }
}
