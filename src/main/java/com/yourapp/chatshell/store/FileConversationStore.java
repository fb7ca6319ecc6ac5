package com.yourapp.chatshell.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one JSON document per conversation. Listing, searching and cleanup re-read every document
 * on each call; a document that cannot be read is logged and left out of the result.
 *
 * <p>Writes overwrite the file in place, so a crash in the middle of a write can leave a truncated
 * document behind. Such a document is skipped by every scan until it is overwritten or removed.
 */
public class FileConversationStore implements ConversationStore {

  private static final Logger log = LoggerFactory.getLogger(FileConversationStore.class);

  private static final String FILE_PREFIX = "conversation_";
  private static final String FILE_SUFFIX = ".json";
  private static final String FILE_GLOB = FILE_PREFIX + "*" + FILE_SUFFIX;

  private final Path directory;
  private final ObjectMapper mapper;
  private final Clock clock;

  public FileConversationStore(Path directory, ObjectMapper mapper, Clock clock) {
    this.directory = directory;
    this.mapper = mapper;
    this.clock = clock;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create conversation directory " + directory, e);
    }
    log.debug("Conversation directory: {}", directory.toAbsolutePath());
  }

  @Override
  public boolean save(Conversation conversation) {
    if (!ConversationStore.isValidId(conversation.id())) {
      log.error("Refusing to save conversation with invalid id '{}'", conversation.id());
      return false;
    }
    ConversationDocument document =
        new ConversationDocument(conversation, clock.instant(), ConversationDocument.CURRENT_VERSION);
    try {
      mapper.writerWithDefaultPrettyPrinter().writeValue(file(conversation.id()).toFile(), document);
      log.debug("Saved conversation {} to file", conversation.id());
      return true;
    } catch (IOException e) {
      log.error("Error saving conversation {} to file", conversation.id(), e);
      return false;
    }
  }

  @Override
  public Optional<Conversation> load(String conversationId) {
    if (!ConversationStore.isValidId(conversationId)) {
      log.warn("Invalid conversation id '{}'", conversationId);
      return Optional.empty();
    }
    Path path = file(conversationId);
    if (!Files.exists(path)) {
      log.warn("Conversation file not found: {}", path);
      return Optional.empty();
    }
    try {
      Conversation conversation = read(path);
      log.debug("Loaded conversation {} from file", conversationId);
      return Optional.of(conversation);
    } catch (ConversationParseException e) {
      log.error("Error loading conversation {} from file", conversationId, e);
      return Optional.empty();
    }
  }

  @Override
  public boolean delete(String conversationId) {
    if (!ConversationStore.isValidId(conversationId)) {
      return false;
    }
    Path path = file(conversationId);
    try {
      if (Files.deleteIfExists(path)) {
        log.info("Deleted conversation file {}", path);
        return true;
      }
      log.warn("Conversation file not found: {}", path);
      return false;
    } catch (IOException e) {
      log.error("Error deleting conversation file {}", path, e);
      return false;
    }
  }

  @Override
  public List<ConversationSummary> list(int limit, int offset) {
    List<ConversationSummary> summaries = new ArrayList<>();
    for (Conversation conversation : readAll()) {
      summaries.add(conversation.summary());
    }
    summaries.sort(ConversationSummary.MOST_RECENT_FIRST);
    return StoreSupport.page(summaries, limit, offset);
  }

  @Override
  public List<ConversationSummary> search(String query, int limit) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    String needle = query.toLowerCase(Locale.ROOT);
    List<ConversationSummary> matches = new ArrayList<>();
    for (Conversation conversation : readAll()) {
      if (StoreSupport.matches(conversation, needle)) {
        matches.add(conversation.summary());
      }
    }
    matches.sort(ConversationSummary.MOST_RECENT_FIRST);
    return StoreSupport.page(matches, limit, 0);
  }

  @Override
  public Map<String, Object> stats() {
    List<Path> files;
    try {
      files = conversationFiles();
    } catch (IOException e) {
      log.error("Error getting conversation stats", e);
      return Map.of();
    }
    long totalSize = 0;
    for (Path path : files) {
      try {
        totalSize += Files.size(path);
      } catch (IOException e) {
        log.warn("Cannot read size of {}", path, e);
      }
    }
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("backend", name());
    stats.put("total_conversations", files.size());
    stats.put("storage_size_bytes", totalSize);
    stats.put("storage_size_mb", Math.round(totalSize / (1024.0 * 1024.0) * 100.0) / 100.0);
    stats.put("storage_directory", directory.toString());
    return stats;
  }

  @Override
  public int cleanup(int days) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    List<Path> files;
    try {
      files = conversationFiles();
    } catch (IOException e) {
      log.error("Error cleaning up old conversations", e);
      return 0;
    }
    int deleted = 0;
    for (Path path : files) {
      try {
        Conversation conversation = read(path);
        if (conversation.updatedAt().isBefore(cutoff)) {
          Files.deleteIfExists(path);
          deleted++;
        }
      } catch (ConversationParseException | IOException e) {
        log.warn("Error processing file {}", path, e);
      }
    }
    log.info("Cleaned up {} old conversation files", deleted);
    return deleted;
  }

  @Override
  public String name() {
    return "file";
  }

  Path file(String conversationId) {
    return directory.resolve(FILE_PREFIX + conversationId + FILE_SUFFIX);
  }

  private List<Conversation> readAll() {
    List<Path> files;
    try {
      files = conversationFiles();
    } catch (IOException e) {
      log.error("Error listing conversation files in {}", directory, e);
      return List.of();
    }
    List<Conversation> conversations = new ArrayList<>(files.size());
    for (Path path : files) {
      try {
        conversations.add(read(path));
      } catch (ConversationParseException e) {
        log.warn("Error reading conversation file {}", path, e);
      }
    }
    return conversations;
  }

  private List<Path> conversationFiles() throws IOException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_GLOB)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          files.add(path);
        }
      }
    }
    return files;
  }

  private Conversation read(Path path) {
    ConversationDocument document;
    try {
      document = mapper.readValue(path.toFile(), ConversationDocument.class);
    } catch (IOException e) {
      throw new ConversationParseException("Unreadable conversation document " + path, e);
    }
    Conversation conversation = document == null ? null : document.conversation();
    if (conversation == null || conversation.id() == null || conversation.updatedAt() == null) {
      throw new ConversationParseException("Incomplete conversation document " + path);
    }
    return conversation;
  }
}
