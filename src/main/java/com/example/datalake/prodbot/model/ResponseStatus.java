package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResponseStatus {
  SUCCESS,
  ERROR,
  NEEDS_CLARIFICATION,
  LOW_CONFIDENCE,
  NO_RESULTS;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
