package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single line of {@code summary.jsonl}, or the same shape built on the fly from the
 * spec and compatibility files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductSummary {
  @JsonProperty("product_id")
  private String productId;
  @JsonProperty("product_name")
  private String productName;
  private String description;
  @JsonProperty("key_specifications")
  @Builder.Default
  private List<KeySpecification> keySpecifications = new ArrayList<>();
  @JsonProperty("key_compatibility")
  @Builder.Default
  private List<KeyCompatibility> keyCompatibility = new ArrayList<>();
  @Builder.Default
  private Map<String, List<String>> identifiers = new LinkedHashMap<>();

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class KeySpecification {
    private String category;
    private String name;
    private String value;
    private String unit;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class KeyCompatibility {
    private String type;
    @JsonProperty("related_product")
    private String relatedProduct;
    @JsonProperty("has_product_id")
    private boolean hasProductId;
    @JsonProperty("numeric_ids")
    private List<String> numericIds = new ArrayList<>();
  }
}
