package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record ClarificationQuestion(Type type, String question, List<ClarificationOption> options) {

  public enum Type {
    PRODUCT_SELECTION,
    PRODUCT_SUGGESTION,
    INTENT_SELECTION,
    GENERAL_CLARIFICATION;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
