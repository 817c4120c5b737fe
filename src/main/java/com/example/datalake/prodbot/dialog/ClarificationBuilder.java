package com.example.datalake.prodbot.dialog;

import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.data.SearchMatch;
import com.example.datalake.prodbot.model.ClarificationOption;
import com.example.datalake.prodbot.model.ClarificationQuestion;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.QueryAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the single most useful follow-up question for an ambiguous query.
 * <p>
 * Priority: several candidate products, then a product mention that resolved to nothing,
 * then an unclear intent, then a plain request to rephrase.
 */
@Slf4j
@Component
public class ClarificationBuilder {

  /** Below this the intent menu is offered instead of a generic rephrase request. */
  public static final double INTENT_MENU_THRESHOLD = 0.3;

  static final int MAX_PRODUCT_OPTIONS = 4;
  static final int MAX_SUGGESTIONS = 3;

  private static final Set<EntityType> PRODUCT_MENTIONS =
      EnumSet.of(EntityType.PRODUCT, EntityType.ARTICLE_NUMBER, EntityType.EAN);

  private static final List<Intent> INTENT_MENU =
      List.of(Intent.TECHNICAL, Intent.COMPATIBILITY, Intent.SUMMARY, Intent.SEARCH);

  private final ProductDataManager dataManager;

  public ClarificationBuilder(ProductDataManager dataManager) {
    this.dataManager = dataManager;
  }

  public List<ClarificationQuestion> build(QueryAnalysis analysis) {
    ClarificationQuestion question = productSelection(analysis)
        .or(() -> productSuggestion(analysis))
        .orElseGet(() -> analysis.confidence() < INTENT_MENU_THRESHOLD
            ? intentSelection()
            : new ClarificationQuestion(ClarificationQuestion.Type.GENERAL_CLARIFICATION,
                ResponseTemplates.GENERIC_CLARIFICATION, List.of()));
    log.debug("[clarification] type={} options={}", question.type().code(), question.options().size());
    return List.of(question);
  }

  private Optional<ClarificationQuestion> productSelection(QueryAnalysis analysis) {
    Set<String> ids = new LinkedHashSet<>();
    for (Entity e : analysis.entities()) {
      if (e.getType() == EntityType.PRODUCT && e.isResolved()) {
        ids.add(e.getProductId());
      }
    }
    if (ids.size() < 2) return Optional.empty();

    List<ClarificationOption> options = ids.stream()
        .limit(MAX_PRODUCT_OPTIONS)
        .map(id -> new ClarificationOption(id, dataManager.getProductName(id)))
        .toList();
    return Optional.of(new ClarificationQuestion(ClarificationQuestion.Type.PRODUCT_SELECTION,
        ResponseTemplates.QUESTION_WHICH_PRODUCT, options));
  }

  private Optional<ClarificationQuestion> productSuggestion(QueryAnalysis analysis) {
    Optional<Entity> vague = analysis.entities().stream()
        .filter(e -> PRODUCT_MENTIONS.contains(e.getType()) && !e.isResolved())
        .findFirst();
    if (vague.isEmpty()) return Optional.empty();

    List<SearchMatch> suggestions = dataManager.suggestProducts(vague.get().getText(), MAX_SUGGESTIONS);
    if (suggestions.isEmpty()) return Optional.empty();

    List<ClarificationOption> options = suggestions.stream()
        .map(m -> new ClarificationOption(m.productId(), m.name()))
        .toList();
    return Optional.of(new ClarificationQuestion(ClarificationQuestion.Type.PRODUCT_SUGGESTION,
        ResponseTemplates.QUESTION_SUGGESTED_PRODUCT, options));
  }

  private static ClarificationQuestion intentSelection() {
    List<ClarificationOption> options = INTENT_MENU.stream()
        .map(i -> new ClarificationOption(i.code(), i.menuLabel()))
        .toList();
    return new ClarificationQuestion(ClarificationQuestion.Type.INTENT_SELECTION,
        ResponseTemplates.QUESTION_WHICH_INTENT, options);
  }
}
