package com.example.datalake.prodbot.model;

import java.util.List;
import java.util.Map;

/**
 * Output of intent analysis. {@code intents} is ordered by combined score, highest first.
 * The per-signal maps are kept for the analysis trace.
 */
public record IntentAnalysis(
    List<IntentScore> intents,
    Intent primaryIntent,
    double confidence,
    Map<Intent, Double> keywordScores,
    Map<Intent, Double> semanticScores,
    Map<Intent, Double> entityScores,
    Map<Intent, Double> contextScores,
    Map<Intent, List<String>> matchedKeywords) {
}
