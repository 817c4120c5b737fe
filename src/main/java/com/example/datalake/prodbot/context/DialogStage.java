package com.example.datalake.prodbot.context;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DialogStage {
  INITIAL,
  SEARCH,
  PRODUCT_EXPLORATION,
  DETAILED_INQUIRY;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
