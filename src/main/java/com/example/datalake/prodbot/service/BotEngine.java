package com.example.datalake.prodbot.service;

import com.example.datalake.prodbot.config.BotProperties;
import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ContextUpdate;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.data.DataResult;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.data.Reports.SearchReport;
import com.example.datalake.prodbot.dialog.ClarificationBuilder;
import com.example.datalake.prodbot.dialog.ResponseGenerator;
import com.example.datalake.prodbot.dialog.ResponseTemplates;
import com.example.datalake.prodbot.model.ClarificationQuestion;
import com.example.datalake.prodbot.model.CommandType;
import com.example.datalake.prodbot.model.EngineResponse;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.QueryAnalysis;
import com.example.datalake.prodbot.model.QueryContext;
import com.example.datalake.prodbot.model.ResponseKind;
import com.example.datalake.prodbot.model.ResponseStatus;
import com.example.datalake.prodbot.processor.IntentAnalyzer;
import com.example.datalake.prodbot.service.CommandParser.ParsedCommand;
import com.example.datalake.prodbot.util.TemplateRenderer;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single entry point for chat input. Structured commands go straight to the data layer;
 * everything else runs through the {@link QueryPipeline} and is answered, guessed at or
 * bounced back with a clarification question depending on intent confidence:
 *
 * <pre>
 *   confidence &lt; clarification-threshold          -&gt; needs_clarification
 *   clarification-threshold &lt;= c &lt; min-confidence  -&gt; low_confidence (best guess)
 *   c &gt;= min-confidence                           -&gt; execute
 * </pre>
 *
 * Nothing thrown inside a request escapes; it becomes an {@code error} response and the
 * session stays usable.
 */
@Slf4j
@Service
public class BotEngine {

  static final int MAX_ALTERNATIVE_INTENTS = 3;

  private final BotProperties props;
  private final QueryPipeline pipeline;
  private final ProductDataManager dataManager;
  private final ContextManager contextManager;
  private final ResponseGenerator responses;
  private final ClarificationBuilder clarifications;
  private final Cache<String, EngineResponse> commandCache;

  private final Instant startedAt = Instant.now();
  private final AtomicLong totalQueries = new AtomicLong();
  private final AtomicLong successfulQueries = new AtomicLong();
  private final AtomicLong commandQueries = new AtomicLong();
  private final AtomicLong naturalLanguageQueries = new AtomicLong();
  private final AtomicLong ambiguousQueries = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  public BotEngine(BotProperties props,
                   QueryPipeline pipeline,
                   ProductDataManager dataManager,
                   ContextManager contextManager,
                   ResponseGenerator responses,
                   ClarificationBuilder clarifications,
                   Cache<String, EngineResponse> commandResponseCache) {
    this.props = props;
    this.pipeline = pipeline;
    this.dataManager = dataManager;
    this.contextManager = contextManager;
    this.responses = responses;
    this.clarifications = clarifications;
    this.commandCache = commandResponseCache;
  }

  public EngineResponse processInput(String text, ConversationContext context) {
    String input = text == null ? "" : text.strip();
    contextManager.updateContext(context, ContextUpdate.query(input));

    Optional<ParsedCommand> command = CommandParser.parse(input);
    if (command.isPresent()) {
      ParsedCommand c = command.get();
      return executeCommand(c.command(), c.productId(), c.params(), context);
    }
    return processNaturalLanguage(input, context);
  }

  // ====== command branch ======

  public EngineResponse executeCommand(CommandType command, String productId, String params, ConversationContext context) {
    totalQueries.incrementAndGet();
    commandQueries.incrementAndGet();
    String p = params == null ? "" : params.strip();
    EngineResponse.EngineResponseBuilder base = EngineResponse.builder()
        .kind(ResponseKind.COMMAND)
        .command(command.flag())
        .productId(productId)
        .params(p);

    try {
      if (!dataManager.validateProductId(productId)) {
        failures.incrementAndGet();
        log.info("[engine] command={} product={} rejected: unknown product", command.flag(), productId);
        return base.status(ResponseStatus.ERROR)
            .message(TemplateRenderer.render(ResponseTemplates.INVALID_PRODUCT, Map.of("product_id", productId)))
            .build();
      }

      ParsedCommand key = new ParsedCommand(command, productId, p);
      EngineResponse cached = commandCache.getIfPresent(key.cacheKey());
      if (cached != null) {
        successfulQueries.incrementAndGet();
        contextManager.updateContext(context, commandUpdate(command, productId));
        log.debug("[engine] cache hit {}", key.cacheKey());
        return cached.toBuilder().cached(true).timestamp(Instant.now()).build();
      }

      DataResult<?> result = fetch(command, productId, p);
      String message = responses.formatCommandResponse(command, productId, result);
      if (!result.isSuccess()) {
        failures.incrementAndGet();
        log.info("[engine] command={} product={} status={}", command.flag(), productId, result.status());
        return base.status(ResponseStatus.ERROR).message(message).result(result).build();
      }

      EngineResponse response = base.status(ResponseStatus.SUCCESS).message(message).result(result).build();
      commandCache.put(key.cacheKey(), response);
      successfulQueries.incrementAndGet();
      contextManager.updateContext(context, commandUpdate(command, productId));
      log.info("[engine] command={} product={} status=success", command.flag(), productId);
      return response;
    } catch (RuntimeException ex) {
      failures.incrementAndGet();
      log.error("Command {} {} '{}' failed", command.flag(), productId, p, ex);
      return base.status(ResponseStatus.ERROR)
          .message(TemplateRenderer.render(ResponseTemplates.COMMAND_ERROR, Map.of("error", String.valueOf(ex.getMessage()))))
          .build();
    }
  }

  private DataResult<?> fetch(CommandType command, String productId, String params) {
    String filter = params.isEmpty() ? null : params;
    switch (command) {
      case TECHNICAL:
        return dataManager.getTechnicalSpecs(productId, filter);
      case COMPATIBILITY:
        return dataManager.getCompatibilityInfo(productId, filter);
      case SUMMARY:
        return dataManager.getProductSummary(productId);
      case FULL_INFO:
      default:
        return dataManager.getFullInfo(productId);
    }
  }

  private static ContextUpdate commandUpdate(CommandType command, String productId) {
    Intent intent;
    switch (command) {
      case TECHNICAL:
        intent = Intent.TECHNICAL;
        break;
      case COMPATIBILITY:
        intent = Intent.COMPATIBILITY;
        break;
      default:
        intent = Intent.SUMMARY;
    }
    return ContextUpdate.builder().productId(productId).intent(intent).build();
  }

  // ====== natural-language branch ======

  private EngineResponse processNaturalLanguage(String input, ConversationContext context) {
    totalQueries.incrementAndGet();
    naturalLanguageQueries.incrementAndGet();
    try {
      QueryContext qc = pipeline.run(input, context).block();
      if (qc == null) {
        throw new IllegalStateException("query pipeline produced no result");
      }
      QueryAnalysis analysis = QueryAnalysis.from(qc);
      double confidence = analysis.confidence();

      EngineResponse.EngineResponseBuilder base = EngineResponse.builder()
          .kind(ResponseKind.NATURAL_LANGUAGE)
          .analysis(analysis)
          .intent(analysis.primaryIntent())
          .confidence(confidence);

      if (confidence < props.clarificationThreshold()) {
        ambiguousQueries.incrementAndGet();
        List<ClarificationQuestion> questions = clarifications.build(analysis);
        log.info("[engine] confidence={} below clarification threshold, asking {}",
            round(confidence), questions.isEmpty() ? "generic" : questions.get(0).type().code());
        return base.status(ResponseStatus.NEEDS_CLARIFICATION)
            .kind(ResponseKind.CLARIFICATION_REQUEST)
            .message(responses.formatClarificationRequest(questions))
            .clarificationQuestions(questions)
            .build();
      }

      Execution execution = execute(analysis, context);
      remember(qc, execution, context);

      if (confidence < props.minConfidence()) {
        ambiguousQueries.incrementAndGet();
        log.info("[engine] confidence={} best guess intent={}", round(confidence), execution.intent().code());
        return base.status(ResponseStatus.LOW_CONFIDENCE)
            .kind(ResponseKind.BEST_GUESS)
            .intent(execution.intent())
            .productId(execution.productId())
            .message(responses.formatLowConfidenceResponse(analysis, execution.message()))
            .alternativeIntents(analysis.alternatives(MAX_ALTERNATIVE_INTENTS))
            .result(execution.result())
            .build();
      }

      ResponseStatus status = execution.status();
      if (status == ResponseStatus.SUCCESS) {
        successfulQueries.incrementAndGet();
      } else if (status == ResponseStatus.ERROR) {
        failures.incrementAndGet();
      }
      log.info("[engine] intent={} product={} confidence={} status={}",
          execution.intent().code(), execution.productId(), round(confidence), status.code());
      return base.status(status)
          .intent(execution.intent())
          .productId(execution.productId())
          .message(execution.message())
          .result(execution.result())
          .build();
    } catch (RuntimeException ex) {
      failures.incrementAndGet();
      log.error("Natural-language query '{}' failed", input, ex);
      return EngineResponse.builder()
          .status(ResponseStatus.ERROR)
          .kind(ResponseKind.NATURAL_LANGUAGE)
          .message(TemplateRenderer.render(ResponseTemplates.ANALYSIS_ERROR, Map.of("error", String.valueOf(ex.getMessage()))))
          .build();
    }
  }

  /**
   * Runs the data call for the primary intent against the target product: the first
   * resolved product entity, else the session's active product. Without a target the
   * query becomes a product search.
   */
  private Execution execute(QueryAnalysis analysis, ConversationContext context) {
    String productId = analysis.entitiesOfType(EntityType.PRODUCT).stream()
        .filter(Entity::isResolved)
        .map(Entity::getProductId)
        .findFirst()
        .orElse(context.hasActiveProduct() ? context.getActiveProductId() : null);

    Intent intent = analysis.primaryIntent();
    if (intent == Intent.SEARCH || productId == null) {
      DataResult<SearchReport> search = dataManager.searchProducts(analysis.processedText());
      boolean empty = search.value().map(r -> r.matches().isEmpty()).orElse(true);
      String message = responses.generateNlResponse(Intent.SEARCH, null, search, context);
      ResponseStatus status = !search.isSuccess() ? ResponseStatus.ERROR
          : empty ? ResponseStatus.NO_RESULTS : ResponseStatus.SUCCESS;
      return new Execution(Intent.SEARCH, null, search, message, status);
    }

    DataResult<?> result;
    switch (intent) {
      case TECHNICAL:
        result = dataManager.getTechnicalSpecs(productId, null);
        break;
      case COMPATIBILITY:
        result = dataManager.getCompatibilityInfo(productId, null);
        break;
      case SUMMARY:
      default:
        result = dataManager.getProductSummary(productId);
    }
    String message = responses.generateNlResponse(intent, productId, result, context);
    return new Execution(intent, productId, result, message,
        result.isSuccess() ? ResponseStatus.SUCCESS : ResponseStatus.ERROR);
  }

  private void remember(QueryContext qc, Execution execution, ConversationContext context) {
    ContextUpdate.ContextUpdateBuilder update = ContextUpdate.builder()
        .productId(execution.productId())
        .intent(execution.intent());
    if (qc.getIntentAnalysis() != null) {
      IntentAnalyzer.mentionedProperty(qc.getIntentAnalysis()).ifPresent(update::property);
    }
    contextManager.updateContext(context, update.build());
  }

  public EngineStats getStats() {
    long total = totalQueries.get();
    long successful = successfulQueries.get();
    return new EngineStats(
        total,
        successful,
        commandQueries.get(),
        naturalLanguageQueries.get(),
        ambiguousQueries.get(),
        failures.get(),
        total == 0 ? 0.0 : (double) successful / total,
        Duration.between(startedAt, Instant.now()).toSeconds());
  }

  private static String round(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  private record Execution(Intent intent, String productId, DataResult<?> result, String message, ResponseStatus status) {}
}
