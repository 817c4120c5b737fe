package com.example.datalake.prodbot.dialog;

import com.example.datalake.prodbot.config.BotProperties;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.data.DataResult;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.data.ProductTextFormatter;
import com.example.datalake.prodbot.data.Reports.CompatibilityReport;
import com.example.datalake.prodbot.data.Reports.SearchReport;
import com.example.datalake.prodbot.data.Reports.SpecsReport;
import com.example.datalake.prodbot.data.Reports.SummaryReport;
import com.example.datalake.prodbot.data.ResultStatus;
import com.example.datalake.prodbot.model.ClarificationOption;
import com.example.datalake.prodbot.model.ClarificationQuestion;
import com.example.datalake.prodbot.model.CommandType;
import com.example.datalake.prodbot.model.ExpertiseLevel;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.IntentScore;
import com.example.datalake.prodbot.model.QueryAnalysis;
import com.example.datalake.prodbot.util.TemplateRenderer;
import com.example.datalake.prodbot.util.TextFolding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns data results into the markdown shown to the user.
 * <p>
 * Command output always uses the configured templates. Natural-language output adapts to
 * the user's expertise: beginners get an intro, flat lists and plainer words; experts get
 * the full categorized detail.
 */
@Slf4j
@Component
public class ResponseGenerator {

  static final int EXPERT_TERM_HITS = 3;
  static final int EXPERT_HISTORY = 10;
  static final int INTERMEDIATE_HISTORY = 3;
  static final int MAX_ALTERNATIVES = 2;

  private static final List<String> TECHNICAL_TERMS = List.of(
      "specifikation", "dimensioner", "tolerans", "teknisk", "material",
      "effekt", "spänning", "kompatibilitet", "monteringsanvisning").stream()
      .map(TextFolding::fold)
      .toList();

  private static final Map<Pattern, String> SIMPLIFICATIONS = new LinkedHashMap<>();
  static {
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Dd]imensioner\\b"), "mått");
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Kk]ompatibilitet\\b"), "passar tillsammans med");
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Ss]pecifikationer\\b"), "egenskaper");
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Mm]ontering\\b"), "installation");
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Tt]olerans\\b"), "tillåten avvikelse");
    SIMPLIFICATIONS.put(Pattern.compile("\\b[Ee]ffekt\\b"), "strömförbrukning");
  }

  private final BotProperties props;
  private final ProductDataManager dataManager;

  public ResponseGenerator(BotProperties props, ProductDataManager dataManager) {
    this.props = props;
    this.dataManager = dataManager;
  }

  // ====== commands ======

  public String formatCommandResponse(CommandType command, String productId, DataResult<?> result) {
    if (!result.isSuccess()) {
      return error(result.message());
    }
    switch (command) {
      case TECHNICAL:
        return TemplateRenderer.render(props.template(BotProperties.TEMPLATE_TECHNICAL),
            productVars(productId, "specifications", result.formattedText()));
      case COMPATIBILITY:
        return TemplateRenderer.render(props.template(BotProperties.TEMPLATE_COMPATIBILITY),
            productVars(productId, "compatibility", result.formattedText()));
      case SUMMARY:
        return renderSummary(productId, result);
      case FULL_INFO:
      default:
        return result.formattedText();
    }
  }

  // ====== natural language ======

  public String generateNlResponse(Intent intent, String productId, DataResult<?> result, ConversationContext context) {
    if (result.status() == ResultStatus.FAILURE) {
      return error(result.message());
    }
    ExpertiseLevel level = inferExpertise(context);
    log.debug("[response] intent={} product={} expertise={}", intent.code(), productId, level.code());
    switch (intent) {
      case TECHNICAL:
        return technicalResponse(productId, result, level);
      case COMPATIBILITY:
        return compatibilityResponse(productId, result, level);
      case SEARCH:
        return searchResponse(result, level);
      case SUMMARY:
      default:
        return summaryResponse(productId, result, level);
    }
  }

  private String technicalResponse(String productId, DataResult<?> result, ExpertiseLevel level) {
    if (!result.isSuccess()) {
      return TemplateRenderer.render(ResponseTemplates.NO_TECHNICAL_INFO, productVars(productId));
    }
    if (level != ExpertiseLevel.BEGINNER) {
      return TemplateRenderer.render(props.template(BotProperties.TEMPLATE_TECHNICAL),
          productVars(productId, "specifications", result.formattedText()));
    }
    String intro = TemplateRenderer.render(ResponseTemplates.TECHNICAL_BEGINNER_INTRO, productVars(productId));
    String flat = result.value()
        .filter(SpecsReport.class::isInstance)
        .map(SpecsReport.class::cast)
        .map(r -> ProductTextFormatter.formatSpecsFlat(r.specs()))
        .orElse(result.formattedText());
    return intro + "\n\n" + simplify(flat);
  }

  private String compatibilityResponse(String productId, DataResult<?> result, ExpertiseLevel level) {
    if (!result.isSuccess()) {
      return TemplateRenderer.render(ResponseTemplates.NO_COMPATIBILITY_INFO, productVars(productId));
    }
    if (level == ExpertiseLevel.EXPERT) {
      return TemplateRenderer.render(props.template(BotProperties.TEMPLATE_COMPATIBILITY),
          productVars(productId, "compatibility", result.formattedText()));
    }
    String intro = TemplateRenderer.render(ResponseTemplates.COMPATIBILITY_INTRO, productVars(productId));
    if (level == ExpertiseLevel.INTERMEDIATE) {
      return intro + "\n\n" + result.formattedText();
    }
    String flat = result.value()
        .filter(CompatibilityReport.class::isInstance)
        .map(CompatibilityReport.class::cast)
        .map(r -> ProductTextFormatter.formatCompatibilityFlat(r.relations()))
        .orElse(result.formattedText());
    return intro + "\n\n" + simplify(flat);
  }

  private String summaryResponse(String productId, DataResult<?> result, ExpertiseLevel level) {
    if (!result.isSuccess()) {
      return TemplateRenderer.render(ResponseTemplates.NO_SUMMARY_INFO, productVars(productId));
    }
    String text = renderSummary(productId, result);
    return level == ExpertiseLevel.BEGINNER ? simplify(text) : text;
  }

  private String searchResponse(DataResult<?> result, ExpertiseLevel level) {
    if (!result.isSuccess()) {
      return ProductTextFormatter.formatSearch(List.of());
    }
    if (level == ExpertiseLevel.EXPERT) {
      return result.value()
          .filter(SearchReport.class::isInstance)
          .map(SearchReport.class::cast)
          .map(r -> ProductTextFormatter.formatSearchTable(r.matches()))
          .orElse(result.formattedText());
    }
    return result.formattedText();
  }

  private String renderSummary(String productId, DataResult<?> result) {
    return result.value()
        .filter(SummaryReport.class::isInstance)
        .map(SummaryReport.class::cast)
        .map(r -> TemplateRenderer.render(props.template(BotProperties.TEMPLATE_SUMMARY),
            ProductTextFormatter.summarySections(r.summary())).stripTrailing())
        .orElse(result.formattedText());
  }

  // ====== uncertainty ======

  public String formatLowConfidenceResponse(QueryAnalysis analysis, String response) {
    String disclaimer = TemplateRenderer.render(ResponseTemplates.LOW_CONFIDENCE_DISCLAIMER,
        Map.of("intent", analysis.primaryIntent().displayName()));
    List<IntentScore> alternatives = analysis.alternatives(MAX_ALTERNATIVES);
    if (alternatives.isEmpty()) {
      return disclaimer + "\n\n" + response;
    }
    String names = alternatives.stream()
        .map(s -> s.intent().displayName())
        .collect(Collectors.joining(", "));
    return disclaimer + "\n\n" + response + "\n\n"
        + TemplateRenderer.render(ResponseTemplates.ALTERNATIVE_INTENTS, Map.of("alternatives", names));
  }

  public String formatClarificationRequest(List<ClarificationQuestion> questions) {
    if (questions == null || questions.isEmpty()) {
      return ResponseTemplates.GENERIC_CLARIFICATION;
    }
    ClarificationQuestion question = questions.get(0);
    switch (question.type()) {
      case PRODUCT_SELECTION:
      case PRODUCT_SUGGESTION:
        String products = question.options().stream()
            .map(o -> "- " + o.text() + " (Art.nr: " + o.id() + ")")
            .collect(Collectors.joining("\n"));
        return TemplateRenderer.render(ResponseTemplates.PRODUCT_CLARIFICATION,
            Map.of("question", question.question(), "options", products));
      case INTENT_SELECTION:
        String intents = question.options().stream()
            .map(ClarificationOption::text)
            .map(t -> "- " + t)
            .collect(Collectors.joining("\n"));
        return TemplateRenderer.render(ResponseTemplates.INTENT_CLARIFICATION,
            Map.of("question", question.question(), "options", intents));
      case GENERAL_CLARIFICATION:
      default:
        return ResponseTemplates.GENERIC_CLARIFICATION;
    }
  }

  public String error(String message) {
    return TemplateRenderer.render(ResponseTemplates.ERROR, Map.of("error", message == null ? "" : message));
  }

  // ====== expertise ======

  /**
   * Pinned level if the session has one, otherwise judged from the vocabulary and length
   * of the query history. A fresh session counts as intermediate.
   */
  public ExpertiseLevel inferExpertise(ConversationContext context) {
    if (context.getExpertiseOverride().isPresent()) {
      return context.getExpertiseOverride().get();
    }
    List<String> history = context.getQueryHistory();
    if (history.isEmpty()) {
      return ExpertiseLevel.INTERMEDIATE;
    }
    int hits = 0;
    for (String query : history) {
      String folded = TextFolding.fold(query);
      for (String term : TECHNICAL_TERMS) {
        if (folded.contains(term)) hits++;
      }
    }
    if (hits >= EXPERT_TERM_HITS || history.size() >= EXPERT_HISTORY) {
      return ExpertiseLevel.EXPERT;
    }
    if (hits >= 1 || history.size() >= INTERMEDIATE_HISTORY) {
      return ExpertiseLevel.INTERMEDIATE;
    }
    return ExpertiseLevel.BEGINNER;
  }

  public static String simplify(String text) {
    String out = text;
    for (Map.Entry<Pattern, String> e : SIMPLIFICATIONS.entrySet()) {
      out = e.getKey().matcher(out).replaceAll(e.getValue());
    }
    return out;
  }

  private Map<String, String> productVars(String productId) {
    Map<String, String> vars = new LinkedHashMap<>();
    vars.put("product_id", productId == null ? "" : productId);
    vars.put("product_name", productId == null ? "" : dataManager.getProductName(productId));
    return vars;
  }

  private Map<String, String> productVars(String productId, String key, String value) {
    Map<String, String> vars = productVars(productId);
    vars.put(key, value);
    return vars;
  }
}
