package com.example.datalake.prodbot.processor;

import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntitySource;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.QueryContext;
import com.example.datalake.prodbot.nlp.EntityRecognizer;
import com.example.datalake.prodbot.util.EanCodes;
import com.example.datalake.prodbot.util.TextFolding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds products, identifiers, dimensions and compatibility markers in the query.
 * <p>
 * Candidates come from the statistical recognizer, the pattern table, the product-name
 * dictionary and the session's active product. Overlapping spans are merged keeping the
 * most confident one, then identifiers are resolved against the indices.
 */
@Slf4j
@Component
public class EntityExtractor implements TextProcessor {

  static final double CONTEXT_CONFIDENCE = 0.8;
  static final double DICTIONARY_CONFIDENCE = 0.9;
  static final double NAME_SIMILARITY_THRESHOLD = 0.8;

  private static final Set<String> ANAPHORS = Set.of("den", "denna", "det", "produkten", "artikeln");

  // ====== Pattern table, in evaluation order ======
  private static final List<ExtractionPattern> PATTERNS = List.of(
      new ExtractionPattern(EntityType.ARTICLE_NUMBER,
          Pattern.compile("(?i)art(?:ikel)?\\.?\\s?(?:nr|nummer)\\.?\\s*[:=]?\\s*([A-Z0-9\\-]{5,15})"), 1, 0.9, false),
      new ExtractionPattern(EntityType.ARTICLE_NUMBER,
          Pattern.compile("(?<!\\d)(\\d{8})(?!\\d)"), 1, 0.9, false),
      new ExtractionPattern(EntityType.EAN,
          Pattern.compile("(?i)EAN(?:-13)?[:.\\-]?\\s*(\\d{13})(?!\\d)"), 1, 0.95, true),
      new ExtractionPattern(EntityType.EAN,
          Pattern.compile("(?<!\\d)(\\d{13})(?!\\d)"), 1, 0.95, true),
      new ExtractionPattern(EntityType.EAN,
          Pattern.compile("(?i)EAN(?:-8)?[:.\\-]?\\s*(\\d{8})(?!\\d)"), 1, 0.95, true),
      new ExtractionPattern(EntityType.EAN,
          Pattern.compile("(?<!\\d)(\\d{12}|\\d{14})(?!\\d)"), 1, 0.9, true),
      new ExtractionPattern(EntityType.DIMENSION,
          Pattern.compile("(\\d+(?:[.,]\\d+)?)\\s*(?:mm|cm|m|tum)(?![\\p{L}\\p{M}\\p{N}])"), 0, 0.85, false),
      new ExtractionPattern(EntityType.COMPATIBILITY,
          Pattern.compile(Normalizer.normalize(
              "(?<![\\p{L}\\p{M}])(kompatibel|passar|fungerar)\\s+(med|till|för|tillsammans)(?![\\p{L}\\p{M}])",
              Normalizer.Form.NFKD), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), 0, 0.85, false)
  );

  private final EntityRecognizer recognizer;
  private final ProductDataManager dataManager;

  public EntityExtractor(EntityRecognizer recognizer, ProductDataManager dataManager) {
    this.recognizer = recognizer;
    this.dataManager = dataManager;
  }

  @Override public String name() { return "entity-extractor"; }

  @Override
  public Mono<QueryContext> process(QueryContext ctx) {
    ConversationContext conversation = ctx.getConversation() == null ? new ConversationContext() : ctx.getConversation();
    List<Entity> entities = extractEntities(ctx.text(), conversation);
    ctx.setEntities(new ArrayList<>(entities));

    Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
    entities.forEach(e -> counts.merge(e.getType(), 1, Integer::sum));
    long resolved = entities.stream().filter(Entity::isResolved).count();
    log.info("[{}] entities={} resolved={} types={}", name(), entities.size(), resolved, counts);
    return Mono.just(ctx.addStep(name(), "entities=" + entities.size() + ", resolved=" + resolved + ", types=" + counts));
  }

  public List<Entity> extractEntities(String text, ConversationContext conversation) {
    if (text == null || text.isBlank()) return List.of();

    List<Entity> candidates = new ArrayList<>();
    candidates.addAll(recognize(text));
    candidates.addAll(patternEntities(text));
    candidates.addAll(dictionaryEntities(text));
    contextEntity(text, conversation).ifPresent(candidates::add);

    List<Entity> merged = mergeOverlapping(candidates);
    return merged.stream().map(this::enrich).toList();
  }

  private List<Entity> recognize(String text) {
    try {
      return recognizer.recognize(text);
    } catch (RuntimeException ex) {
      log.warn("[{}] recognizer {} failed, continuing without it: {}", name(), recognizer.name(), ex.toString());
      return List.of();
    }
  }

  List<Entity> patternEntities(String text) {
    List<Entity> out = new ArrayList<>();
    for (ExtractionPattern p : PATTERNS) {
      Matcher m = p.pattern().matcher(text);
      while (m.find()) {
        String value = m.group(p.group());
        if (p.eanChecked() && !EanCodes.isValid(value)) continue;
        out.add(Entity.builder()
            .type(p.type())
            .text(value)
            .start(m.start(p.group()))
            .end(m.end(p.group()))
            .confidence(p.confidence())
            .source(EntitySource.REGEX)
            .build());
      }
    }
    return out;
  }

  /**
   * Every occurrence of a known product name, inflected forms included ("Oslos").
   * Matching runs on folded text, positions refer to the input.
   */
  List<Entity> dictionaryEntities(String text) {
    String folded = TextFolding.fold(text);
    boolean sameLength = folded.length() == text.length();
    List<Entity> out = new ArrayList<>();
    for (Map.Entry<String, String> e : dataManager.productNameDictionary().entrySet()) {
      String name = e.getKey();
      if (name.isEmpty()) continue;
      int from = 0;
      int idx;
      while ((idx = folded.indexOf(name, from)) >= 0) {
        int end = idx + name.length();
        out.add(Entity.builder()
            .type(EntityType.PRODUCT)
            .text(sameLength ? text.substring(idx, end) : folded.substring(idx, end))
            .start(idx)
            .end(end)
            .confidence(DICTIONARY_CONFIDENCE)
            .source(EntitySource.PRODUCT_INDEX)
            .productId(e.getValue())
            .build());
        from = idx + 1;
      }
    }
    return out;
  }

  Optional<Entity> contextEntity(String text, ConversationContext conversation) {
    if (!conversation.hasActiveProduct()) return Optional.empty();
    boolean anaphor = TextFolding.words(text).stream().anyMatch(ANAPHORS::contains);
    if (!anaphor) return Optional.empty();

    String productId = conversation.getActiveProductId();
    return Optional.of(Entity.builder()
        .type(EntityType.PRODUCT)
        .text(dataManager.getProductName(productId))
        .start(-1)
        .end(-1)
        .confidence(CONTEXT_CONFIDENCE)
        .source(EntitySource.CONTEXT)
        .productId(productId)
        .contextualReference(true)
        .build());
  }

  /**
   * Sorts by (start, longest first) and collapses overlapping positioned spans into the most
   * confident one. Unpositioned entities never overlap anything. Applying it to its own
   * output changes nothing.
   */
  public static List<Entity> mergeOverlapping(List<Entity> entities) {
    if (entities.size() < 2) return List.copyOf(entities);

    List<Entity> sorted = new ArrayList<>(entities);
    sorted.sort(Comparator.comparingInt(Entity::getStart).thenComparing(Comparator.comparingInt(Entity::length).reversed()));

    List<Entity> merged = new ArrayList<>();
    Entity current = sorted.get(0);
    for (int i = 1; i < sorted.size(); i++) {
      Entity next = sorted.get(i);
      boolean overlaps = current.isPositioned() && next.isPositioned() && current.getEnd() >= next.getStart();
      if (overlaps) {
        if (next.getConfidence() > current.getConfidence()) {
          current = next;
        }
      } else {
        merged.add(current);
        current = next;
      }
    }
    merged.add(current);
    return merged;
  }

  Entity enrich(Entity entity) {
    switch (entity.getType()) {
      case PRODUCT:
        if (entity.isResolved()) return entity;
        Optional<String> byName = dataManager.lookupProductName(entity.getText())
            .or(() -> dataManager.findSimilarProductName(entity.getText(), NAME_SIMILARITY_THRESHOLD));
        return byName.map(id -> entity.toBuilder().productId(id).build()).orElse(entity);
      case ARTICLE_NUMBER:
        Optional<String> byArticle = dataManager.lookupArticleNumber(entity.getText());
        if (byArticle.isEmpty() && dataManager.validateProductId(entity.getText())) {
          byArticle = Optional.of(entity.getText());
        }
        return byArticle.map(id -> asProduct(entity, id)).orElse(entity);
      case EAN:
        if (!EanCodes.isValid(entity.getText())) return entity;
        return dataManager.lookupEan(entity.getText()).map(id -> asProduct(entity, id)).orElse(entity);
      default:
        return entity;
    }
  }

  private static Entity asProduct(Entity entity, String productId) {
    return entity.toBuilder().type(EntityType.PRODUCT).productId(productId).build();
  }

  private record ExtractionPattern(EntityType type, Pattern pattern, int group, double confidence, boolean eanChecked) {}
}
