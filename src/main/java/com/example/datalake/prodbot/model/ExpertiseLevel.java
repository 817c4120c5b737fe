package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExpertiseLevel {
  BEGINNER,
  INTERMEDIATE,
  EXPERT;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
