package com.example.datalake.prodbot.context;

import com.example.datalake.prodbot.model.ExpertiseLevel;
import com.example.datalake.prodbot.model.Intent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Session state owned by the caller and passed into every engine call.
 * <p>
 * Only {@link ContextManager#updateContext} mutates it; everything else reads through the
 * getters, which return copies. One request at a time per session.
 */
public class ConversationContext {

  public static final int MAX_HISTORY = 10;

  private final Instant createdAt = Instant.now();
  private final Set<String> mentionedProducts = new LinkedHashSet<>();
  private final Deque<String> queryHistory = new ArrayDeque<>();
  private String activeProductId;
  private Intent previousIntent;
  private String lastMentionedProperty;
  private ExpertiseLevel expertiseOverride;

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getActiveProductId() {
    return activeProductId;
  }

  public boolean hasActiveProduct() {
    return activeProductId != null && !activeProductId.isBlank();
  }

  public List<String> getMentionedProducts() {
    return List.copyOf(mentionedProducts);
  }

  public Intent getPreviousIntent() {
    return previousIntent;
  }

  public List<String> getQueryHistory() {
    return List.copyOf(queryHistory);
  }

  public String getLastMentionedProperty() {
    return lastMentionedProperty;
  }

  public Optional<ExpertiseLevel> getExpertiseOverride() {
    return Optional.ofNullable(expertiseOverride);
  }

  // mutators, reachable only through ContextManager

  void setActiveProductId(String productId) {
    this.activeProductId = productId;
  }

  void addMentionedProduct(String productId) {
    mentionedProducts.add(productId);
  }

  void setPreviousIntent(Intent intent) {
    this.previousIntent = intent;
  }

  void appendQuery(String query) {
    queryHistory.addLast(query);
    while (queryHistory.size() > MAX_HISTORY) {
      queryHistory.removeFirst();
    }
  }

  void setLastMentionedProperty(String property) {
    this.lastMentionedProperty = property;
  }

  void setExpertiseOverride(ExpertiseLevel level) {
    this.expertiseOverride = level;
  }
}
