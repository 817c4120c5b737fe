package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/** One line of {@code technical_specs.jsonl}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TechnicalSpec {
  private String category;
  private String name;
  @JsonProperty("raw_value")
  private String rawValue;
  private String unit;
  private String importance;
  private Double confidence;
  @JsonProperty("product_id")
  private String productId;

  /** high > medium > normal > low; unknown values rank with normal. */
  public int importanceRank() {
    if (importance == null) return 1;
    switch (importance.toLowerCase(Locale.ROOT)) {
      case "high": return 3;
      case "medium": return 2;
      case "low": return 0;
      default: return 1;
    }
  }
}
