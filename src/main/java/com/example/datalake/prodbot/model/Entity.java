package com.example.datalake.prodbot.model;

import lombok.Builder;
import lombok.Value;

/**
 * A typed span of the query, or an implicit reference to the active product
 * ({@code start == end == -1}).
 */
@Value
@Builder(toBuilder = true)
public class Entity {
  EntityType type;
  String text;
  int start;
  int end;
  double confidence;
  EntitySource source;
  String productId;
  boolean contextualReference;

  public boolean isPositioned() {
    return start >= 0 && end >= 0;
  }

  public boolean isResolved() {
    return productId != null && !productId.isBlank();
  }

  public int length() {
    return text == null ? 0 : text.length();
  }
}
