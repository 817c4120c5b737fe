package com.example.datalake.prodbot.service;

import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.context.ConversationState;
import com.example.datalake.prodbot.model.EngineResponse;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Keeps one {@link ConversationContext} per chat session and serializes requests within a
 * session, so the engine sees a single writer per context.
 */
@Slf4j
@Service
public class ConversationSessionService {

  private final BotEngine engine;
  private final ContextManager contextManager;
  private final Cache<String, ConversationContext> sessions;

  public ConversationSessionService(BotEngine engine,
                                    ContextManager contextManager,
                                    Cache<String, ConversationContext> sessionCache) {
    this.engine = engine;
    this.contextManager = contextManager;
    this.sessions = sessionCache;
  }

  public SessionReply chat(String sessionId, String query) {
    String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
    ConversationContext context = sessions.get(id, key -> {
      log.debug("[session] new session {}", key);
      return new ConversationContext();
    });
    EngineResponse response;
    synchronized (context) {
      response = engine.processInput(query, context);
    }
    return new SessionReply(id, response);
  }

  public Optional<ConversationState> state(String sessionId) {
    return Optional.ofNullable(sessions.getIfPresent(sessionId)).map(contextManager::describeState);
  }

  public boolean forget(String sessionId) {
    boolean known = sessions.getIfPresent(sessionId) != null;
    sessions.invalidate(sessionId);
    return known;
  }

  public record SessionReply(String sessionId, EngineResponse response) {}
}
