package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReferenceType {
  PRODUCT,
  PROPERTY,
  MULTIPLE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
