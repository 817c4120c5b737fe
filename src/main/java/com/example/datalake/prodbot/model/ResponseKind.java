package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which engine branch produced a response. */
public enum ResponseKind {
  COMMAND,
  NATURAL_LANGUAGE,
  CLARIFICATION_REQUEST,
  BEST_GUESS;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
