package com.example.datalake.prodbot.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of everything the pipeline learned about one query.
 */
public record QueryAnalysis(
    String originalQuery,
    String processedText,
    List<Entity> entities,
    List<IntentScore> intents,
    Intent primaryIntent,
    double confidence,
    QueryType queryType,
    List<ContextReference> references,
    Map<String, ResolvedReference> resolvedEntities,
    Map<Intent, List<String>> matchedKeywords,
    List<StepLog> steps) {

  public static QueryAnalysis from(QueryContext ctx) {
    IntentAnalysis intent = ctx.getIntentAnalysis();
    ContextAnalysis context = ctx.getContextAnalysis() == null
        ? ContextAnalysis.independent()
        : ctx.getContextAnalysis();
    return new QueryAnalysis(
        ctx.getRawInput(),
        ctx.text(),
        List.copyOf(ctx.getEntities()),
        intent == null ? List.of() : intent.intents(),
        intent == null ? Intent.SUMMARY : intent.primaryIntent(),
        intent == null ? 0.1 : intent.confidence(),
        context.queryType(),
        context.references(),
        context.resolvedEntities(),
        intent == null ? Map.of() : intent.matchedKeywords(),
        List.copyOf(ctx.getSteps()));
  }

  public List<Entity> entitiesOfType(EntityType type) {
    return entities.stream().filter(e -> e.getType() == type).toList();
  }

  public List<IntentScore> alternatives(int max) {
    return intents.stream().skip(1).limit(max).toList();
  }
}
