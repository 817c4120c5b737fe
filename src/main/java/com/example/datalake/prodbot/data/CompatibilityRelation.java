package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** One line of {@code compatibility.jsonl}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompatibilityRelation {
  @JsonProperty("relation_type")
  private String relationType;
  @JsonProperty("related_product")
  private String relatedProduct;
  @JsonProperty("numeric_ids")
  @Builder.Default
  private List<String> numericIds = new ArrayList<>();
  private String context;
  private Double confidence;
  @JsonProperty("product_id")
  private String productId;

  public boolean hasNumericIds() {
    return numericIds != null && !numericIds.isEmpty();
  }

  public double confidenceOrZero() {
    return confidence == null ? 0.0 : confidence;
  }
}
