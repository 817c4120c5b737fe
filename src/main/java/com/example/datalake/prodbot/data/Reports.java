package com.example.datalake.prodbot.data;

import java.util.List;
import java.util.Map;

/**
 * Payloads carried by successful {@link DataResult}s.
 */
public final class Reports {

  private Reports() {}

  public record SpecsReport(String productId, List<TechnicalSpec> specs, Map<String, List<TechnicalSpec>> byCategory) {}

  public record CompatibilityReport(String productId, List<CompatibilityRelation> relations,
                                    Map<String, List<CompatibilityRelation>> byType) {}

  public record SummaryReport(ProductSummary summary, boolean generated) {}

  public record FullInfoReport(String productId, String content) {}

  public record SearchReport(String query, List<SearchMatch> matches) {}
}
