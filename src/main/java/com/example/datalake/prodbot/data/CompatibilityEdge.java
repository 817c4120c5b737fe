package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Entry of {@code compatibility_map.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompatibilityEdge(
    @JsonProperty("related_product") String relatedProduct,
    @JsonProperty("relation_type") String relationType,
    @JsonProperty("numeric_ids") List<String> numericIds) {

  public CompatibilityEdge {
    numericIds = numericIds == null ? List.of() : List.copyOf(numericIds);
  }
}
