package com.yourapp.chatshell.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourapp.chatshell.store.ConversationStore;
import com.yourapp.chatshell.store.FileConversationStore;
import com.yourapp.chatshell.store.RediSearchIndex;
import com.yourapp.chatshell.store.RedisConversationStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses the conversation backend once, when the context starts. Redis is preferred; if it cannot
 * be reached the file store is used for the rest of the session, even if Redis comes back later.
 */
@Configuration
public class ConversationStoreConfig {

  private static final Logger log = LoggerFactory.getLogger(ConversationStoreConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ConversationStore conversationStore(
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper mapper,
      Clock clock,
      @Value("${app.store.use-redis:true}") boolean useRedis,
      @Value("${app.store.file.directory:conversations}") String directory,
      @Value("${app.store.redis.ttl:P30D}") Duration ttl,
      @Value("${app.store.redis.content-limit:5000}") int contentLimit) {
    Supplier<ConversationStore> fileStore =
        () -> new FileConversationStore(Path.of(directory), mapper, clock);

    if (!useRedis) {
      log.info("Using file storage for conversations");
      return fileStore.get();
    }

    return select(() -> {
      StringRedisTemplate redis = redisTemplate.getObject();
      return new RedisConversationStore(
          redis, mapper, new RediSearchIndex(redis), ttl, contentLimit, clock);
    }, fileStore);
  }

  static ConversationStore select(
      Supplier<? extends ConversationStore> preferred,
      Supplier<? extends ConversationStore> fallback) {
    try {
      ConversationStore store = preferred.get();
      log.info("Using {} for conversation storage", store.name());
      return store;
    } catch (RuntimeException e) {
      log.warn("Failed to initialize preferred storage: {}", e.getMessage());
      log.info("Falling back to file storage");
      return fallback.get();
    }
  }
}
