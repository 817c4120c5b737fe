package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a query depends on earlier turns of the conversation. */
public enum QueryType {
  INDEPENDENT,
  FOLLOW_UP,
  REFERENCE,
  COMPARISON;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
