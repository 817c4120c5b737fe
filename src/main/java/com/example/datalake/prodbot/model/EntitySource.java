package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an {@link Entity} candidate came from.
 */
public enum EntitySource {
  REGEX("regex"),
  NER("ner"),
  PRODUCT_INDEX("product_index"),
  CONTEXT("context");

  private final String code;

  EntitySource(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
