package com.example.datalake.prodbot.data;

import com.example.datalake.prodbot.util.TemplateRenderer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown rendering for corpus data. Command responses, natural-language responses and
 * both summary paths all go through here.
 */
public final class ProductTextFormatter {

  /** Layout of a product summary; placeholders are filled by {@link #summarySections}. */
  public static final String SUMMARY_LAYOUT =
      "# {product_name}\n\n**Artikelnummer:** {product_id}\n\n{identifiers}{description}{specifications}{compatibility}";

  public static final String SEARCH_HINT =
      "Använd kommandot `-s <artikelnr>` för att se mer information om en produkt.";
  public static final String NO_SEARCH_RESULTS = "Inga produkter hittades som matchar din sökning.";

  private ProductTextFormatter() {}

  // ====== technical specs ======

  public static String formatSpecs(Map<String, List<TechnicalSpec>> byCategory) {
    List<String> lines = new ArrayList<>();
    byCategory.forEach((category, specs) -> {
      lines.add("## " + category);
      for (TechnicalSpec spec : specs) {
        String line = specLine(spec.getName(), spec.getRawValue(), spec.getUnit());
        if (line != null) lines.add(line);
      }
      lines.add("");
    });
    return String.join("\n", lines).stripTrailing();
  }

  public static String formatSpecsFlat(List<TechnicalSpec> specs) {
    List<String> lines = new ArrayList<>();
    for (TechnicalSpec spec : specs) {
      String line = specLine(spec.getName(), spec.getRawValue(), spec.getUnit());
      if (line != null) lines.add(line);
    }
    return String.join("\n", lines);
  }

  /** {@code - **name:** value unit}, the unit only when the value does not already carry it. */
  public static String specLine(String name, String value, String unit) {
    if (isBlank(name) || isBlank(value)) return null;
    StringBuilder sb = new StringBuilder("- **").append(name).append(":** ").append(value);
    if (!isBlank(unit) && !value.contains(unit)) {
      sb.append(' ').append(unit);
    }
    return sb.toString();
  }

  // ====== compatibility ======

  public static String formatCompatibility(Map<String, List<CompatibilityRelation>> byType) {
    List<String> lines = new ArrayList<>();
    byType.forEach((type, relations) -> {
      lines.add("## " + RelationLabels.label(type));
      for (CompatibilityRelation relation : relations) {
        String line = relationLine(relation.getRelatedProduct(), relation.getNumericIds());
        if (line != null) lines.add(line);
      }
      lines.add("");
    });
    return String.join("\n", lines).stripTrailing();
  }

  public static String formatCompatibilityFlat(List<CompatibilityRelation> relations) {
    List<String> lines = new ArrayList<>();
    for (CompatibilityRelation relation : relations) {
      String line = relationLine(relation.getRelatedProduct(), relation.getNumericIds());
      if (line != null) {
        lines.add("- " + RelationLabels.label(relation.getRelationType()) + ": " + line.substring(2));
      }
    }
    return String.join("\n", lines);
  }

  public static String relationLine(String relatedProduct, List<String> numericIds) {
    if (isBlank(relatedProduct)) return null;
    String line = "- " + relatedProduct;
    if (numericIds != null && !numericIds.isEmpty()) {
      line += " (Art.nr: " + numericIds.get(0) + ")";
    }
    return line;
  }

  // ====== summary ======

  public static String formatSummary(ProductSummary summary) {
    return TemplateRenderer.render(SUMMARY_LAYOUT, summarySections(summary)).stripTrailing();
  }

  /**
   * Placeholder values for a summary template. Section values are complete markdown blocks
   * ending in a blank line, or empty when the summary has nothing for them.
   */
  public static Map<String, String> summarySections(ProductSummary summary) {
    Map<String, String> sections = new LinkedHashMap<>();
    String id = summary.getProductId() == null ? "" : summary.getProductId();
    sections.put("product_id", id);
    sections.put("product_name", isBlank(summary.getProductName()) ? "Produkt " + id : summary.getProductName());
    sections.put("identifiers", identifiersSection(summary.getIdentifiers()));
    sections.put("description", isBlank(summary.getDescription())
        ? ""
        : "## Beskrivning\n" + summary.getDescription() + "\n\n");
    sections.put("specifications", keySpecificationsSection(summary.getKeySpecifications()));
    sections.put("compatibility", keyCompatibilitySection(summary.getKeyCompatibility()));
    return sections;
  }

  private static String identifiersSection(Map<String, List<String>> identifiers) {
    if (identifiers == null || identifiers.isEmpty()) return "";
    StringBuilder sb = new StringBuilder();
    identifiers.forEach((type, values) -> {
      if (values != null && !values.isEmpty()) {
        sb.append("**").append(type).append(":** ").append(String.join(", ", values)).append('\n');
      }
    });
    return sb.length() == 0 ? "" : sb.append('\n').toString();
  }

  private static String keySpecificationsSection(List<ProductSummary.KeySpecification> specs) {
    if (specs == null || specs.isEmpty()) return "";
    Map<String, List<ProductSummary.KeySpecification>> byCategory = new LinkedHashMap<>();
    for (ProductSummary.KeySpecification spec : specs) {
      String category = isBlank(spec.getCategory()) ? "Övrigt" : spec.getCategory();
      byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(spec);
    }
    StringBuilder sb = new StringBuilder("## Viktiga specifikationer\n");
    byCategory.forEach((category, group) -> {
      if (byCategory.size() > 1) sb.append("### ").append(category).append('\n');
      for (ProductSummary.KeySpecification spec : group) {
        String line = specLine(spec.getName(), spec.getValue(), spec.getUnit());
        if (line != null) sb.append(line).append('\n');
      }
    });
    return sb.append('\n').toString();
  }

  private static String keyCompatibilitySection(List<ProductSummary.KeyCompatibility> relations) {
    if (relations == null || relations.isEmpty()) return "";
    Map<String, List<ProductSummary.KeyCompatibility>> byType = new LinkedHashMap<>();
    for (ProductSummary.KeyCompatibility relation : relations) {
      String type = isBlank(relation.getType()) ? "other" : relation.getType();
      byType.computeIfAbsent(type, k -> new ArrayList<>()).add(relation);
    }
    StringBuilder sb = new StringBuilder("## Kompatibilitet\n");
    byType.forEach((type, group) -> {
      if (byType.size() > 1) sb.append("### ").append(RelationLabels.label(type)).append('\n');
      for (ProductSummary.KeyCompatibility relation : group) {
        String line = relationLine(relation.getRelatedProduct(), relation.getNumericIds());
        if (line != null) sb.append(line).append('\n');
      }
    });
    return sb.append('\n').toString();
  }

  // ====== search ======

  public static String formatSearch(List<SearchMatch> matches) {
    List<String> lines = new ArrayList<>(List.of("## Sökresultat", ""));
    if (matches.isEmpty()) {
      lines.add(NO_SEARCH_RESULTS);
    } else {
      for (int i = 0; i < matches.size(); i++) {
        SearchMatch m = matches.get(i);
        lines.add((i + 1) + ". **" + m.name() + "** (Art.nr: " + m.productId() + ")");
      }
      lines.add("");
      lines.add(SEARCH_HINT);
    }
    return String.join("\n", lines);
  }

  /** Tabular search listing with match scores. */
  public static String formatSearchTable(List<SearchMatch> matches) {
    if (matches.isEmpty()) return "## Sökresultat\n\n" + NO_SEARCH_RESULTS;
    StringBuilder sb = new StringBuilder("## Sökresultat\n\n| # | Produkt | Art.nr | Poäng | Träff |\n|---|---|---|---|---|\n");
    for (int i = 0; i < matches.size(); i++) {
      SearchMatch m = matches.get(i);
      sb.append("| ").append(i + 1)
          .append(" | ").append(m.name())
          .append(" | ").append(m.productId())
          .append(" | ").append(String.format(Locale.ROOT, "%.2f", m.score()))
          .append(" | ").append(m.matchType() == SearchMatch.MatchType.EXACT ? "exakt" : "ungefärlig")
          .append(" |\n");
    }
    return sb.append('\n').append(SEARCH_HINT).toString();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
