package com.example.datalake.prodbot.data;

import com.example.datalake.prodbot.util.TextFolding;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory snapshot of the index files, loaded once. Name and word keys are folded
 * so they compare against preprocessed queries.
 */
@Slf4j
public final class CorpusIndex {

  static final String ARTICLE_NUMBERS = "article_numbers.json";
  static final String EAN_NUMBERS = "ean_numbers.json";
  static final String COMPATIBILITY_MAP = "compatibility_map.json";
  static final String TEXT_SEARCH = "text_search_index.json";
  static final String PRODUCT_NAMES = "product_names.json";

  private static final TypeReference<Map<String, List<IndexedIdentifier>>> IDENTIFIER_INDEX = new TypeReference<>() {};
  private static final TypeReference<Map<String, List<CompatibilityEdge>>> COMPATIBILITY_INDEX = new TypeReference<>() {};
  private static final TypeReference<Map<String, List<String>>> WORD_INDEX = new TypeReference<>() {};
  private static final TypeReference<Map<String, NameEntry>> NAME_INDEX = new TypeReference<>() {};

  private final Map<String, List<IndexedIdentifier>> articleNumbers;
  private final Map<String, List<IndexedIdentifier>> eanNumbers;
  private final Map<String, List<CompatibilityEdge>> compatibilityMap;
  private final Map<String, List<String>> textSearch;
  private final Map<String, String> productNames;
  private final Map<String, String> nameToId;

  CorpusIndex(Map<String, List<IndexedIdentifier>> articleNumbers,
              Map<String, List<IndexedIdentifier>> eanNumbers,
              Map<String, List<CompatibilityEdge>> compatibilityMap,
              Map<String, List<String>> textSearch,
              Map<String, String> productNames) {
    this.articleNumbers = Map.copyOf(articleNumbers);
    this.eanNumbers = Map.copyOf(eanNumbers);
    this.compatibilityMap = Map.copyOf(compatibilityMap);
    this.productNames = Map.copyOf(productNames);

    Map<String, List<String>> words = new LinkedHashMap<>();
    textSearch.forEach((word, ids) -> {
      List<String> bucket = words.computeIfAbsent(TextFolding.fold(word), k -> new ArrayList<>());
      for (String id : ids) {
        if (!bucket.contains(id)) bucket.add(id);
      }
    });
    this.textSearch = Map.copyOf(words);

    Map<String, String> names = new LinkedHashMap<>();
    productNames.forEach((id, name) -> {
      if (name != null && !name.isBlank()) names.putIfAbsent(TextFolding.fold(name.strip()), id);
    });
    this.nameToId = Collections.unmodifiableMap(names);
  }

  public static CorpusIndex load(Path indicesDir, ObjectMapper mapper) {
    Map<String, NameEntry> names = read(indicesDir.resolve(PRODUCT_NAMES), mapper, NAME_INDEX);
    Map<String, String> productNames = new LinkedHashMap<>();
    names.forEach((id, entry) -> {
      if (entry != null && entry.name() != null) productNames.put(id, entry.name());
    });

    CorpusIndex index = new CorpusIndex(
        read(indicesDir.resolve(ARTICLE_NUMBERS), mapper, IDENTIFIER_INDEX),
        read(indicesDir.resolve(EAN_NUMBERS), mapper, IDENTIFIER_INDEX),
        read(indicesDir.resolve(COMPATIBILITY_MAP), mapper, COMPATIBILITY_INDEX),
        read(indicesDir.resolve(TEXT_SEARCH), mapper, WORD_INDEX),
        productNames);
    log.info("Loaded corpus index from {}: names={}, articles={}, eans={}, words={}",
        indicesDir, index.productNames.size(), index.articleNumbers.size(), index.eanNumbers.size(),
        index.textSearch.size());
    return index;
  }

  public static CorpusIndex empty() {
    return new CorpusIndex(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
  }

  private static <T> Map<String, T> read(Path file, ObjectMapper mapper, TypeReference<Map<String, T>> type) {
    if (!Files.isRegularFile(file)) {
      log.warn("Index file {} not found, continuing without it", file);
      return Map.of();
    }
    try {
      Map<String, T> value = mapper.readValue(file.toFile(), type);
      return value == null ? Map.of() : value;
    } catch (IOException ex) {
      log.error("Could not read index file {}: {}", file, ex.getMessage());
      return Map.of();
    }
  }

  public List<IndexedIdentifier> articleNumber(String value) {
    return articleNumbers.getOrDefault(value, List.of());
  }

  public List<IndexedIdentifier> ean(String value) {
    return eanNumbers.getOrDefault(value, List.of());
  }

  public List<CompatibilityEdge> compatibility(String productId) {
    return compatibilityMap.getOrDefault(productId, List.of());
  }

  public List<String> productsWithWord(String foldedWord) {
    return textSearch.getOrDefault(foldedWord, List.of());
  }

  public String productName(String productId) {
    return productNames.get(productId);
  }

  /** Folded display name to product ID, in index order. */
  public Map<String, String> nameToId() {
    return nameToId;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record NameEntry(String name) {}
}
