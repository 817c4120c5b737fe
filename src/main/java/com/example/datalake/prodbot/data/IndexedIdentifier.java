package com.example.datalake.prodbot.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Entry of {@code article_numbers.json} / {@code ean_numbers.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexedIdentifier(@JsonProperty("product_id") String productId, @JsonProperty("id_type") String idType) {
}
