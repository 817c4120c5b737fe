package com.example.datalake.prodbot.data;

import java.util.List;

/**
 * A compatibility neighbour. {@code productId} is null when the related name could not be
 * mapped onto the corpus.
 */
public record RelatedProduct(String productId, String name, String relationType, List<String> numericIds) {
}
