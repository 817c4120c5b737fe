package com.example.datalake.prodbot.context;

import com.example.datalake.prodbot.model.ContextAnalysis;
import com.example.datalake.prodbot.model.ContextReference;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.QueryType;
import com.example.datalake.prodbot.model.ReferenceType;
import com.example.datalake.prodbot.model.ResolvedReference;
import com.example.datalake.prodbot.util.TextFolding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and maintains conversation state: classifies how a query leans on earlier turns,
 * resolves anaphors against the session, and is the single writer of
 * {@link ConversationContext}.
 */
@Slf4j
@Component
public class ContextManager {

  private static final int SHORT_QUERY_TOKENS = 3;

  // checked in this order, first hit wins
  private static final Map<QueryType, List<Pattern>> QUERY_TYPE_TERMS = new LinkedHashMap<>();
  static {
    QUERY_TYPE_TERMS.put(QueryType.FOLLOW_UP, patterns(
        "mer", "fortsätt", "berätta mer", "och", "också"));
    QUERY_TYPE_TERMS.put(QueryType.REFERENCE, patterns(
        "den", "denna", "det", "dessa", "dom", "dom här", "den där", "detta"));
    QUERY_TYPE_TERMS.put(QueryType.COMPARISON, patterns(
        "jämfört med", "kontra", "vs", "versus", "jämför", "skillnad", "skillnaden mellan"));
  }

  private static final List<ReferenceTerm> REFERENCE_TERMS = referenceTerms();

  public ContextAnalysis analyzeContext(String query, ConversationContext context) {
    String folded = TextFolding.fold(query);
    QueryType type = identifyQueryType(folded, context);
    if (type == QueryType.INDEPENDENT) {
      return new ContextAnalysis(type, List.of(), Map.of(), context.getMentionedProducts(),
          context.getActiveProductId(), context.getPreviousIntent());
    }

    List<ContextReference> references = new ArrayList<>();
    Map<String, ResolvedReference> resolved = new LinkedHashMap<>();
    for (ContextReference ref : identifyReferences(folded)) {
      ResolvedReference resolution = resolve(ref.type(), context);
      references.add(new ContextReference(ref.type(), ref.text(), ref.start(), ref.end(), resolution));
      if (resolution != null) {
        resolved.putIfAbsent(ref.text(), resolution);
      }
    }
    log.debug("[context] type={} references={} resolved={}", type, references.size(), resolved.size());
    return new ContextAnalysis(type, List.copyOf(references), Map.copyOf(resolved),
        context.getMentionedProducts(), context.getActiveProductId(), context.getPreviousIntent());
  }

  QueryType identifyQueryType(String folded, ConversationContext context) {
    for (Map.Entry<QueryType, List<Pattern>> e : QUERY_TYPE_TERMS.entrySet()) {
      for (Pattern p : e.getValue()) {
        if (p.matcher(folded).find()) {
          return e.getKey();
        }
      }
    }
    if (context.hasActiveProduct() && TextFolding.words(folded).size() <= SHORT_QUERY_TOKENS) {
      return QueryType.FOLLOW_UP;
    }
    return QueryType.INDEPENDENT;
  }

  /**
   * Anaphor spans in the folded query, longest phrases first so "den här" is not also
   * reported as "den". Results are ordered by position.
   */
  List<ContextReference> identifyReferences(String folded) {
    List<ContextReference> found = new ArrayList<>();
    for (ReferenceTerm term : REFERENCE_TERMS) {
      Matcher m = term.pattern().matcher(folded);
      while (m.find()) {
        int start = m.start();
        int end = m.end();
        boolean overlaps = found.stream().anyMatch(r -> start < r.end() && r.start() < end);
        if (!overlaps) {
          found.add(new ContextReference(term.type(), m.group(), start, end, null));
        }
      }
    }
    found.sort(Comparator.comparingInt(ContextReference::start));
    return found;
  }

  private ResolvedReference resolve(ReferenceType type, ConversationContext context) {
    switch (type) {
      case PRODUCT:
        return context.hasActiveProduct() ? ResolvedReference.product(context.getActiveProductId()) : null;
      case PROPERTY:
        String property = context.getLastMentionedProperty();
        return property == null || property.isBlank() ? null : ResolvedReference.property(property);
      case MULTIPLE:
        List<String> products = context.getMentionedProducts();
        return products.isEmpty() ? null : ResolvedReference.multiple(products);
      default:
        return null;
    }
  }

  /**
   * Applies {@code update} to the session. The only mutator of {@link ConversationContext}.
   */
  public ConversationContext updateContext(ConversationContext context, ContextUpdate update) {
    if (update.getQuery() != null) {
      context.appendQuery(update.getQuery());
    }
    if (update.getProductId() != null && !update.getProductId().isBlank()) {
      context.setActiveProductId(update.getProductId());
      context.addMentionedProduct(update.getProductId());
    }
    if (update.getIntent() != null) {
      context.setPreviousIntent(update.getIntent());
    }
    if (update.getProperty() != null && !update.getProperty().isBlank()) {
      context.setLastMentionedProperty(update.getProperty());
    }
    if (update.getExpertiseLevel() != null) {
      context.setExpertiseOverride(update.getExpertiseLevel());
    }
    return context;
  }

  public ConversationState describeState(ConversationContext context) {
    DialogStage stage;
    if (context.getQueryHistory().isEmpty()) {
      stage = DialogStage.INITIAL;
    } else if (context.hasActiveProduct()) {
      Intent previous = context.getPreviousIntent();
      stage = previous == Intent.TECHNICAL || previous == Intent.COMPATIBILITY
          ? DialogStage.DETAILED_INQUIRY
          : DialogStage.PRODUCT_EXPLORATION;
    } else {
      stage = DialogStage.SEARCH;
    }
    return new ConversationState(
        stage,
        context.getActiveProductId(),
        context.getMentionedProducts(),
        context.getPreviousIntent(),
        context.getQueryHistory().size(),
        Duration.between(context.getCreatedAt(), Instant.now()).toSeconds());
  }

  private static List<Pattern> patterns(String... terms) {
    List<Pattern> out = new ArrayList<>(terms.length);
    for (String t : terms) out.add(TextFolding.termPattern(t));
    return List.copyOf(out);
  }

  private static List<ReferenceTerm> referenceTerms() {
    Map<ReferenceType, List<String>> lexicon = new LinkedHashMap<>();
    lexicon.put(ReferenceType.PRODUCT, List.of("den", "denna", "den här", "den där", "produkten", "artikeln"));
    lexicon.put(ReferenceType.PROPERTY, List.of("det", "detta", "den egenskapen", "den funktionen"));
    lexicon.put(ReferenceType.MULTIPLE, List.of("dessa", "de", "dom", "de här", "dom här", "produkterna"));

    List<ReferenceTerm> terms = new ArrayList<>();
    lexicon.forEach((type, words) -> words.forEach(w -> terms.add(new ReferenceTerm(type, w, TextFolding.termPattern(w)))));
    terms.sort(Comparator.comparingInt((ReferenceTerm t) -> t.term().length()).reversed());
    return List.copyOf(terms);
  }

  private record ReferenceTerm(ReferenceType type, String term, Pattern pattern) {}
}
