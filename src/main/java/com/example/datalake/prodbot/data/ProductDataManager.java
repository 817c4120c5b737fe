package com.example.datalake.prodbot.data;

import com.example.datalake.prodbot.config.BotProperties;
import com.example.datalake.prodbot.data.Reports.CompatibilityReport;
import com.example.datalake.prodbot.data.Reports.FullInfoReport;
import com.example.datalake.prodbot.data.Reports.SearchReport;
import com.example.datalake.prodbot.data.Reports.SpecsReport;
import com.example.datalake.prodbot.data.Reports.SummaryReport;
import com.example.datalake.prodbot.util.TextFolding;
import com.example.datalake.prodbot.util.TokenSimilarity;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the product corpus. Index files are loaded once at construction;
 * product files are read per call. Expected failures come back as {@link DataResult}s.
 */
@Slf4j
@Service
public class ProductDataManager {

  static final String TECHNICAL_SPECS = "technical_specs.jsonl";
  static final String COMPATIBILITY = "compatibility.jsonl";
  static final String ARTICLE_INFO = "article_info.jsonl";
  static final String SUMMARY = "summary.jsonl";
  static final String FULL_INFO = "full_info.md";

  static final String NO_SPECS = "Inga tekniska specifikationer tillgängliga";
  static final String NO_COMPATIBILITY = "Ingen kompatibilitetsinformation tillgänglig";
  static final String NO_FULL_INFO = "Ingen fullständig information tillgänglig";
  static final String NO_SUMMARY = "Ingen sammanfattning tillgänglig";

  private static final Set<String> DESCRIPTION_CATEGORIES = Set.of("general", "allmänt", "beskrivning", "description");
  private static final Set<String> DESCRIPTION_NAMES = Set.of("beskrivning", "description");
  private static final int SUMMARY_KEY_ITEMS = 5;
  private static final double FUZZY_THRESHOLD = 0.2;

  private final Path productsDir;
  private final CorpusIndex index;
  private final JsonlReader jsonl;
  private final int maxSearchResults;

  public ProductDataManager(BotProperties props, ObjectMapper mapper) {
    Path root = Path.of(props.dataDir()).toAbsolutePath().normalize();
    this.productsDir = root.resolve("products");
    this.index = CorpusIndex.load(root.resolve("indices"), mapper);
    this.jsonl = new JsonlReader(mapper);
    this.maxSearchResults = props.maxSearchResults();
    if (!Files.isDirectory(productsDir)) {
      log.warn("Products directory {} does not exist, every product lookup will fail", productsDir);
    }
  }

  // ====== identity ======

  public boolean validateProductId(String productId) {
    return productDir(productId).map(Files::isDirectory).orElse(false);
  }

  public String getProductName(String productId) {
    String name = index.productName(productId);
    return name == null || name.isBlank() ? "Produkt " + productId : name;
  }

  /** Folded display name to product ID, for dictionary matching. */
  public Map<String, String> productNameDictionary() {
    return index.nameToId();
  }

  public Optional<String> lookupProductName(String name) {
    return Optional.ofNullable(index.nameToId().get(TextFolding.fold(name).strip()));
  }

  /**
   * Best product whose name has token-Jaccard similarity of at least {@code threshold} with
   * {@code text}.
   */
  public Optional<String> findSimilarProductName(String text, double threshold) {
    Set<String> words = TextFolding.wordSet(text);
    String best = null;
    double bestScore = -1;
    for (Map.Entry<String, String> e : index.nameToId().entrySet()) {
      double score = TokenSimilarity.jaccard(words, TextFolding.wordSet(e.getKey()));
      if (score >= threshold && score > bestScore) {
        best = e.getValue();
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  public Optional<String> lookupArticleNumber(String value) {
    return firstProduct(index.articleNumber(value));
  }

  public Optional<String> lookupEan(String value) {
    return firstProduct(index.ean(value));
  }

  private static Optional<String> firstProduct(List<IndexedIdentifier> entries) {
    return entries.stream()
        .map(IndexedIdentifier::productId)
        .filter(id -> id != null && !id.isBlank())
        .findFirst();
  }

  // ====== technical specifications ======

  public DataResult<SpecsReport> getTechnicalSpecs(String productId, String filter) {
    Optional<Path> file = productFile(productId, TECHNICAL_SPECS);
    if (file.isEmpty()) {
      return DataResult.notFound(NO_SPECS);
    }
    List<TechnicalSpec> specs;
    try {
      specs = jsonl.read(file.get(), TechnicalSpec.class);
    } catch (IOException ex) {
      log.error("Could not read technical specs for {}: {}", productId, ex.getMessage());
      return DataResult.failure("Kunde inte läsa tekniska specifikationer: " + ex.getMessage());
    }

    Map<String, List<TechnicalSpec>> grouped = new LinkedHashMap<>();
    for (TechnicalSpec spec : specs) {
      String category = spec.getCategory() == null || spec.getCategory().isBlank() ? "Övrigt" : spec.getCategory();
      grouped.computeIfAbsent(category, k -> new ArrayList<>()).add(spec);
    }

    List<String> terms = filterTerms(filter);
    if (!terms.isEmpty()) {
      Map<String, List<TechnicalSpec>> filtered = new LinkedHashMap<>();
      grouped.forEach((category, group) -> {
        if (containsAny(category, terms)) {
          filtered.put(category, group);
          return;
        }
        List<TechnicalSpec> matching = group.stream()
            .filter(s -> containsAny(s.getName(), terms) || containsAny(s.getRawValue(), terms))
            .toList();
        if (!matching.isEmpty()) filtered.put(category, matching);
      });
      // a filter that matches nothing shows everything
      if (!filtered.isEmpty()) grouped = filtered;
    }

    Map<String, List<TechnicalSpec>> sorted = new LinkedHashMap<>();
    grouped.forEach((category, group) -> sorted.put(category, group.stream()
        .sorted(Comparator.comparingInt(TechnicalSpec::importanceRank).reversed())
        .toList()));

    SpecsReport report = new SpecsReport(productId, List.copyOf(specs), sorted);
    return DataResult.success(report, ProductTextFormatter.formatSpecs(sorted));
  }

  // ====== compatibility ======

  public DataResult<CompatibilityReport> getCompatibilityInfo(String productId, String filter) {
    Optional<Path> file = productFile(productId, COMPATIBILITY);
    if (file.isEmpty()) {
      return DataResult.notFound(NO_COMPATIBILITY);
    }
    List<CompatibilityRelation> relations;
    try {
      relations = jsonl.read(file.get(), CompatibilityRelation.class);
    } catch (IOException ex) {
      log.error("Could not read compatibility for {}: {}", productId, ex.getMessage());
      return DataResult.failure("Kunde inte läsa kompatibilitetsinformation: " + ex.getMessage());
    }

    Map<String, List<CompatibilityRelation>> grouped = new LinkedHashMap<>();
    for (CompatibilityRelation relation : relations) {
      String type = relation.getRelationType() == null || relation.getRelationType().isBlank()
          ? "other"
          : relation.getRelationType();
      grouped.computeIfAbsent(type, k -> new ArrayList<>()).add(relation);
    }

    List<String> terms = filterTerms(filter);
    if (!terms.isEmpty()) {
      Map<String, List<CompatibilityRelation>> filtered = new LinkedHashMap<>();
      grouped.forEach((type, group) -> {
        if (containsAny(type, terms) || containsAny(RelationLabels.label(type), terms)) {
          filtered.put(type, group);
          return;
        }
        List<CompatibilityRelation> matching = group.stream()
            .filter(r -> containsAny(r.getRelatedProduct(), terms) || containsAny(r.getContext(), terms))
            .toList();
        if (!matching.isEmpty()) filtered.put(type, matching);
      });
      if (!filtered.isEmpty()) grouped = filtered;
    }

    Map<String, List<CompatibilityRelation>> sorted = new LinkedHashMap<>();
    grouped.forEach((type, group) -> sorted.put(type, group.stream()
        .sorted(Comparator.comparingDouble(CompatibilityRelation::confidenceOrZero).reversed())
        .toList()));

    CompatibilityReport report = new CompatibilityReport(productId, List.copyOf(relations), sorted);
    return DataResult.success(report, ProductTextFormatter.formatCompatibility(sorted));
  }

  // ====== summaries ======

  public DataResult<SummaryReport> getProductSummary(String productId) {
    Optional<Path> file = productFile(productId, SUMMARY);
    if (file.isPresent()) {
      try {
        List<ProductSummary> lines = jsonl.read(file.get(), ProductSummary.class);
        if (!lines.isEmpty()) {
          ProductSummary summary = lines.get(0);
          if (summary.getProductId() == null) summary.setProductId(productId);
          return DataResult.success(new SummaryReport(summary, false), ProductTextFormatter.formatSummary(summary));
        }
        log.warn("Summary file for {} holds no readable line, generating one", productId);
      } catch (IOException ex) {
        log.warn("Could not read summary for {}: {}, generating one", productId, ex.getMessage());
      }
    }
    return generateDynamicSummary(productId);
  }

  /**
   * Builds a summary from the spec, compatibility and article-info files.
   */
  public DataResult<SummaryReport> generateDynamicSummary(String productId) {
    if (!validateProductId(productId)) {
      return DataResult.notFound(NO_SUMMARY);
    }
    ProductSummary summary = ProductSummary.builder()
        .productId(productId)
        .productName(getProductName(productId))
        .build();

    getTechnicalSpecs(productId, "").value().ifPresent(report -> {
      for (TechnicalSpec spec : report.specs()) {
        if (spec.getCategory() != null && DESCRIPTION_CATEGORIES.contains(spec.getCategory().toLowerCase(Locale.ROOT))
            && spec.getName() != null && DESCRIPTION_NAMES.contains(spec.getName().toLowerCase(Locale.ROOT))) {
          summary.setDescription(spec.getRawValue());
        }
      }
      report.specs().stream()
          .sorted(Comparator.comparingInt(TechnicalSpec::importanceRank).reversed()
              .thenComparing(s -> s.getCategory() == null ? "" : s.getCategory()))
          .limit(SUMMARY_KEY_ITEMS)
          .forEach(s -> summary.getKeySpecifications().add(new ProductSummary.KeySpecification(
              s.getCategory(), s.getName(), s.getRawValue(), s.getUnit())));
    });

    getCompatibilityInfo(productId, "").value().ifPresent(report -> report.relations().stream()
        .sorted(Comparator.comparing(CompatibilityRelation::hasNumericIds)
            .thenComparingDouble(CompatibilityRelation::confidenceOrZero)
            .reversed())
        .limit(SUMMARY_KEY_ITEMS)
        .forEach(r -> summary.getKeyCompatibility().add(new ProductSummary.KeyCompatibility(
            r.getRelationType(), r.getRelatedProduct(), r.hasNumericIds(),
            r.getNumericIds() == null ? new ArrayList<>() : new ArrayList<>(r.getNumericIds())))));

    productFile(productId, ARTICLE_INFO).ifPresent(path -> {
      try {
        for (ProductIdentifier id : jsonl.read(path, ProductIdentifier.class)) {
          if (id.getType() != null && !id.getType().isBlank() && id.getValue() != null && !id.getValue().isBlank()) {
            summary.getIdentifiers().computeIfAbsent(id.getType(), k -> new ArrayList<>()).add(id.getValue());
          }
        }
      } catch (IOException ex) {
        log.warn("Could not read identifiers for {}: {}", productId, ex.getMessage());
      }
    });

    return DataResult.success(new SummaryReport(summary, true), ProductTextFormatter.formatSummary(summary));
  }

  // ====== full text ======

  public DataResult<FullInfoReport> getFullInfo(String productId) {
    Optional<Path> file = productFile(productId, FULL_INFO);
    if (file.isEmpty()) {
      return DataResult.notFound(NO_FULL_INFO);
    }
    try {
      String content = Files.readString(file.get(), StandardCharsets.UTF_8);
      return DataResult.success(new FullInfoReport(productId, content), content);
    } catch (IOException ex) {
      log.error("Could not read full info for {}: {}", productId, ex.getMessage());
      return DataResult.failure("Kunde inte läsa fullständig information: " + ex.getMessage());
    }
  }

  // ====== search ======

  public DataResult<SearchReport> searchProducts(String query) {
    return searchProducts(query, maxSearchResults);
  }

  /**
   * Exact hits from the word index score 1.0; fuzzy name matches fill up the remaining slots.
   */
  public DataResult<SearchReport> searchProducts(String query, int maxResults) {
    Set<String> queryWords = TextFolding.wordSet(query);
    List<SearchMatch> results = new ArrayList<>();

    Set<String> exact = new LinkedHashSet<>();
    for (String word : queryWords) {
      exact.addAll(index.productsWithWord(word));
    }
    for (String productId : exact) {
      results.add(new SearchMatch(productId, getProductName(productId), 1.0, SearchMatch.MatchType.EXACT));
    }

    if (results.size() < maxResults) {
      Set<String> seen = new LinkedHashSet<>(exact);
      for (SearchMatch match : fuzzyMatches(queryWords, maxResults)) {
        if (seen.add(match.productId())) results.add(match);
      }
    }

    List<SearchMatch> top = results.stream()
        .sorted(Comparator.comparingDouble(SearchMatch::score).reversed())
        .limit(maxResults)
        .toList();
    log.debug("[search] query='{}' exact={} returned={}", query, exact.size(), top.size());
    return DataResult.success(new SearchReport(query, top), ProductTextFormatter.formatSearch(top));
  }

  public List<SearchMatch> suggestProducts(String query, int maxSuggestions) {
    return searchProducts(query, maxSuggestions).value().map(SearchReport::matches).orElse(List.of());
  }

  private List<SearchMatch> fuzzyMatches(Set<String> queryWords, int maxResults) {
    if (queryWords.isEmpty()) return List.of();
    List<SearchMatch> scored = new ArrayList<>();
    for (Map.Entry<String, String> e : index.nameToId().entrySet()) {
      Set<String> nameWords = TextFolding.wordSet(e.getKey());
      int overlap = TokenSimilarity.overlap(queryWords, nameWords);
      if (overlap == 0) continue;
      double score = TokenSimilarity.jaccard(queryWords, nameWords);
      if (overlap > 1) score += 0.1 * overlap;
      if (nameWords.size() <= 2) score *= 0.8;
      if (score > FUZZY_THRESHOLD) {
        scored.add(new SearchMatch(e.getValue(), getProductName(e.getValue()), score, SearchMatch.MatchType.FUZZY));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingDouble(SearchMatch::score).reversed())
        .limit(maxResults)
        .toList();
  }

  // ====== relations ======

  /**
   * Compatibility neighbours from the index, optionally restricted to {@code relationTypes}.
   * Related names resolve to IDs through their numeric IDs first, then the name index.
   */
  public List<RelatedProduct> findRelatedProducts(String productId, Collection<String> relationTypes) {
    List<RelatedProduct> out = new ArrayList<>();
    for (CompatibilityEdge edge : index.compatibility(productId)) {
      if (relationTypes != null && !relationTypes.isEmpty() && !relationTypes.contains(edge.relationType())) {
        continue;
      }
      String relatedId = edge.numericIds().stream()
          .filter(this::validateProductId)
          .findFirst()
          .orElseGet(() -> edge.relatedProduct() == null ? null : lookupProductName(edge.relatedProduct()).orElse(null));
      out.add(new RelatedProduct(relatedId, edge.relatedProduct(), edge.relationType(), edge.numericIds()));
    }
    return out;
  }

  // ====== helpers ======

  private Optional<Path> productDir(String productId) {
    if (productId == null || productId.isBlank()) return Optional.empty();
    try {
      Path dir = productsDir.resolve(productId).normalize();
      if (!dir.startsWith(productsDir) || dir.equals(productsDir)) {
        log.warn("Rejected product id outside the corpus: {}", productId);
        return Optional.empty();
      }
      return Optional.of(dir);
    } catch (InvalidPathException ex) {
      log.debug("Invalid product id {}: {}", productId, ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<Path> productFile(String productId, String fileName) {
    return productDir(productId)
        .map(dir -> dir.resolve(fileName))
        .filter(Files::isRegularFile);
  }

  private static List<String> filterTerms(String filter) {
    if (filter == null || filter.isBlank()) return List.of();
    return TextFolding.words(filter);
  }

  private static boolean containsAny(String text, List<String> terms) {
    if (text == null) return false;
    String folded = TextFolding.fold(text);
    for (String term : terms) {
      if (folded.contains(term)) return true;
    }
    return false;
  }
}
