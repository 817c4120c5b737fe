package com.example.datalake.prodbot.processor;

import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.IntentAnalysis;
import com.example.datalake.prodbot.model.IntentScore;
import com.example.datalake.prodbot.model.QueryContext;
import com.example.datalake.prodbot.nlp.EmbeddingProvider;
import com.example.datalake.prodbot.util.TextFolding;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scores the four intents from keywords, semantic similarity, entity types and the
 * previous turn, and combines them linearly.
 */
@Slf4j
@Component
public class IntentAnalyzer implements TextProcessor {

  static final double KEYWORD_WEIGHT = 0.35;
  static final double SEMANTIC_WEIGHT = 0.30;
  static final double ENTITY_WEIGHT = 0.25;
  static final double CONTEXT_WEIGHT = 0.10;

  static final double NEUTRAL_SUMMARY = 0.1;
  static final double UNCERTAIN_MARGIN = 0.1;
  static final double CONFIDENT_MARGIN = 0.3;

  private static final Map<Intent, List<String>> KEYWORDS = new EnumMap<>(Intent.class);
  static {
    KEYWORDS.put(Intent.TECHNICAL, folded(
        "teknisk", "specifikation", "mått", "dimension", "vikt", "material",
        "effekt", "spänning", "ström", "hur ser", "hur stor", "hur tung"));
    KEYWORDS.put(Intent.COMPATIBILITY, folded(
        "passar", "kompatibel", "fungerar med", "kan användas med", "passar till",
        "monteringsstolpe", "trycke", "tillsammans med", "går att använda"));
    KEYWORDS.put(Intent.SUMMARY, folded(
        "berätta om", "vad är", "information om", "beskriv", "sammanfatta",
        "översikt", "produktfakta", "vad betyder", "vad innebär"));
    KEYWORDS.put(Intent.SEARCH, folded(
        "hitta", "sök", "leta", "finns det", "har ni", "jag letar efter",
        "jag behöver en", "alternativ till", "liknande"));
  }

  // generic technical words that do not name a property
  private static final Set<String> NON_PROPERTY_KEYWORDS = Set.copyOf(folded(
      "teknisk", "specifikation", "hur ser", "hur stor", "hur tung"));

  static final Map<Intent, List<String>> PROTOTYPES = new EnumMap<>(Intent.class);
  static {
    PROTOTYPES.put(Intent.TECHNICAL, List.of(
        "Vad är de tekniska specifikationerna för denna produkt?",
        "Vilka mått har produkten?",
        "Hur mycket väger produkten?",
        "Vilket material är produkten tillverkad av?",
        "Vad är spänningen för produkten?"));
    PROTOTYPES.put(Intent.COMPATIBILITY, List.of(
        "Är denna produkt kompatibel med andra produkter?",
        "Passar produkten till min existerande installation?",
        "Vilka andra produkter fungerar med denna?",
        "Kan jag använda denna med produkt X?",
        "Vilka trycken passar denna produkt?"));
    PROTOTYPES.put(Intent.SUMMARY, List.of(
        "Berätta om denna produkt",
        "Vad är detta för produkt?",
        "Ge mig en översikt över produkten",
        "Vilken information finns om produkten?",
        "Vad används denna produkt till?"));
    PROTOTYPES.put(Intent.SEARCH, List.of(
        "Jag letar efter en produkt som...",
        "Hitta produkter som liknar...",
        "Sök efter produkter som...",
        "Finns det några produkter för...",
        "Jag behöver en produkt som kan..."));
  }

  private final EmbeddingProvider embeddings;
  private final Map<Intent, Embedding> prototypeVectors;

  public IntentAnalyzer(EmbeddingProvider embeddings) {
    this.embeddings = embeddings;
    this.prototypeVectors = buildPrototypes(embeddings);
    log.info("[{}] semantic prototypes={} provider={}", name(), prototypeVectors.size(), embeddings.name());
  }

  @Override public String name() { return "intent-analyzer"; }

  @Override
  public Mono<QueryContext> process(QueryContext ctx) {
    ConversationContext conversation = ctx.getConversation() == null ? new ConversationContext() : ctx.getConversation();
    IntentAnalysis analysis = analyzeIntent(ctx.text(), ctx.getEntities(), conversation);
    ctx.setIntentAnalysis(analysis);

    log.info("[{}] primary={} confidence={}", name(), analysis.primaryIntent().code(),
        String.format(Locale.ROOT, "%.3f", analysis.confidence()));
    return Mono.just(ctx.addStep(name(), "primary=" + analysis.primaryIntent().code()
        + ", confidence=" + String.format(Locale.ROOT, "%.3f", analysis.confidence())));
  }

  public IntentAnalysis analyzeIntent(String text, List<Entity> entities, ConversationContext conversation) {
    String folded = TextFolding.fold(text);
    Map<Intent, List<String>> matched = matchKeywords(folded);
    Map<Intent, Double> keyword = keywordScores(matched);
    Map<Intent, Double> semantic = semanticScores(text);
    Map<Intent, Double> entity = entityScores(entities);
    Map<Intent, Double> context = contextScores(conversation);

    Map<Intent, Double> combined = new EnumMap<>(Intent.class);
    for (Intent intent : Intent.values()) {
      combined.put(intent, KEYWORD_WEIGHT * keyword.get(intent)
          + SEMANTIC_WEIGHT * semantic.get(intent)
          + ENTITY_WEIGHT * entity.get(intent)
          + CONTEXT_WEIGHT * context.get(intent));
    }

    List<IntentScore> ranked = new ArrayList<>();
    combined.forEach((intent, score) -> ranked.add(new IntentScore(intent, score)));
    // stable: ties keep declaration order
    ranked.sort(Comparator.comparingDouble(IntentScore::score).reversed());

    IntentScore primary = ranked.isEmpty() ? new IntentScore(Intent.SUMMARY, NEUTRAL_SUMMARY) : ranked.get(0);
    double confidence = adjustConfidence(ranked, primary.score());
    return new IntentAnalysis(List.copyOf(ranked), primary.intent(), confidence,
        keyword, semantic, entity, context, matched);
  }

  /**
   * Close runner-up lowers confidence, a clear winner raises it. Needs at least two
   * distinct scores.
   */
  static double adjustConfidence(List<IntentScore> ranked, double top) {
    Set<Double> distinct = new LinkedHashSet<>();
    ranked.forEach(s -> distinct.add(s.score()));
    if (ranked.size() < 2 || distinct.size() < 2) return top;

    double margin = top - ranked.get(1).score();
    if (margin < UNCERTAIN_MARGIN) return top * 0.8;
    if (margin > CONFIDENT_MARGIN) return Math.min(1.0, top * 1.1);
    return top;
  }

  // ====== keyword signal ======

  Map<Intent, List<String>> matchKeywords(String folded) {
    Map<Intent, List<String>> matched = new EnumMap<>(Intent.class);
    KEYWORDS.forEach((intent, words) -> matched.put(intent,
        words.stream().filter(folded::contains).toList()));
    return matched;
  }

  Map<Intent, Double> keywordScores(Map<Intent, List<String>> matched) {
    Map<Intent, Double> scores = zeroScores();
    boolean any = false;
    for (Intent intent : Intent.values()) {
      int hits = matched.getOrDefault(intent, List.of()).size();
      double score = (double) hits / KEYWORDS.get(intent).size();
      scores.put(intent, score);
      any |= hits > 0;
    }
    if (!any) scores.put(Intent.SUMMARY, NEUTRAL_SUMMARY);
    return scores;
  }

  /**
   * First matched technical keyword that names a property, e.g. "vikt" or "spänning".
   */
  public static Optional<String> mentionedProperty(IntentAnalysis analysis) {
    return analysis.matchedKeywords().getOrDefault(Intent.TECHNICAL, List.of()).stream()
        .filter(k -> !NON_PROPERTY_KEYWORDS.contains(k))
        .findFirst();
  }

  // ====== semantic signal ======

  Map<Intent, Double> semanticScores(String text) {
    Map<Intent, Double> scores = zeroScores();
    if (prototypeVectors.isEmpty()) return scores;
    Optional<Embedding> query = embeddings.embed(text);
    if (query.isEmpty()) return scores;

    prototypeVectors.forEach((intent, prototype) -> {
      double cosine = CosineSimilarity.between(query.get(), prototype);
      scores.put(intent, (cosine + 1.0) / 2.0);
    });
    return scores;
  }

  private static Map<Intent, Embedding> buildPrototypes(EmbeddingProvider provider) {
    Map<Intent, Embedding> out = new EnumMap<>(Intent.class);
    PROTOTYPES.forEach((intent, examples) -> {
      List<float[]> vectors = new ArrayList<>();
      for (String example : examples) {
        provider.embed(example).ifPresent(e -> vectors.add(e.vector()));
      }
      if (!vectors.isEmpty()) out.put(intent, Embedding.from(mean(vectors)));
    });
    return out;
  }

  private static float[] mean(List<float[]> vectors) {
    float[] sum = new float[vectors.get(0).length];
    for (float[] v : vectors) {
      for (int i = 0; i < sum.length && i < v.length; i++) sum[i] += v[i];
    }
    for (int i = 0; i < sum.length; i++) sum[i] /= vectors.size();
    return sum;
  }

  // ====== entity signal ======

  Map<Intent, Double> entityScores(List<Entity> entities) {
    Map<Intent, Double> scores = zeroScores();
    if (entities == null || entities.isEmpty()) {
      scores.put(Intent.SUMMARY, 0.2);
      return scores;
    }
    long dimensions = entities.stream().filter(e -> e.getType() == EntityType.DIMENSION).count();
    long products = entities.stream().filter(e -> e.getType() == EntityType.PRODUCT).count();
    boolean compatibility = entities.stream().anyMatch(e -> e.getType() == EntityType.COMPATIBILITY);

    if (dimensions > 0) {
      add(scores, Intent.TECHNICAL, 0.6 * Math.min(dimensions, 3) / 3.0);
    }
    if (compatibility) {
      add(scores, Intent.COMPATIBILITY, 0.8);
    }
    if (products > 1) {
      add(scores, Intent.SEARCH, 0.5);
      if (compatibility) add(scores, Intent.COMPATIBILITY, 0.3);
    } else if (products == 1) {
      add(scores, Intent.SUMMARY, 0.4);
      add(scores, Intent.TECHNICAL, 0.3);
    }
    return scores;
  }

  // ====== context signal ======

  Map<Intent, Double> contextScores(ConversationContext conversation) {
    Map<Intent, Double> scores = zeroScores();
    if (conversation.getQueryHistory().isEmpty()) {
      scores.put(Intent.SUMMARY, 0.1);
      return scores;
    }
    Intent previous = conversation.getPreviousIntent();
    if (previous == null) return scores;
    switch (previous) {
      case SUMMARY:
        add(scores, Intent.TECHNICAL, 0.2);
        add(scores, Intent.COMPATIBILITY, 0.2);
        break;
      case TECHNICAL:
        add(scores, Intent.TECHNICAL, 0.3);
        break;
      case COMPATIBILITY:
        add(scores, Intent.COMPATIBILITY, 0.3);
        break;
      case SEARCH:
        if (conversation.hasActiveProduct()) add(scores, Intent.SUMMARY, 0.4);
        break;
      default:
        break;
    }
    return scores;
  }

  // ====== helpers ======

  private static Map<Intent, Double> zeroScores() {
    Map<Intent, Double> scores = new EnumMap<>(Intent.class);
    for (Intent intent : Intent.values()) scores.put(intent, 0.0);
    return scores;
  }

  private static void add(Map<Intent, Double> scores, Intent intent, double delta) {
    scores.merge(intent, delta, Double::sum);
  }

  private static List<String> folded(String... words) {
    List<String> out = new ArrayList<>(words.length);
    for (String w : words) out.add(TextFolding.fold(w));
    return List.copyOf(out);
  }
}
