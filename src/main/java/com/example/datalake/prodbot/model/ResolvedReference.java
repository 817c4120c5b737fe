package com.example.datalake.prodbot.model;

import java.util.List;

/**
 * What a reference points at. Exactly one of the value fields is set, depending on
 * {@link #type()}.
 */
public record ResolvedReference(ReferenceType type, String productId, String property, List<String> productIds) {

  public static ResolvedReference product(String productId) {
    return new ResolvedReference(ReferenceType.PRODUCT, productId, null, List.of());
  }

  public static ResolvedReference property(String property) {
    return new ResolvedReference(ReferenceType.PROPERTY, null, property, List.of());
  }

  public static ResolvedReference multiple(List<String> productIds) {
    return new ResolvedReference(ReferenceType.MULTIPLE, null, null, List.copyOf(productIds));
  }
}
