package com.example.datalake.prodbot.context;

import com.example.datalake.prodbot.model.ExpertiseLevel;
import com.example.datalake.prodbot.model.Intent;
import lombok.Builder;
import lombok.Value;

/**
 * Changes to apply to a {@link ConversationContext}. Null fields leave state untouched.
 */
@Value
@Builder
public class ContextUpdate {
  String query;
  String productId;
  Intent intent;
  String property;
  ExpertiseLevel expertiseLevel;

  public static ContextUpdate query(String query) {
    return ContextUpdate.builder().query(query).build();
  }
}
