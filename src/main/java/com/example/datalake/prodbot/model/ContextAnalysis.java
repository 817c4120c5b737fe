package com.example.datalake.prodbot.model;

import java.util.List;
import java.util.Map;

public record ContextAnalysis(
    QueryType queryType,
    List<ContextReference> references,
    Map<String, ResolvedReference> resolvedEntities,
    List<String> contextProducts,
    String activeProductId,
    Intent previousIntent) {

  public static ContextAnalysis independent() {
    return new ContextAnalysis(QueryType.INDEPENDENT, List.of(), Map.of(), List.of(), null, null);
  }
}
