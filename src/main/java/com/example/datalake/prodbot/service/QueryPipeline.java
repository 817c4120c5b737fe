package com.example.datalake.prodbot.service;

import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.model.QueryContext;
import com.example.datalake.prodbot.processor.ContextAnalysisProcessor;
import com.example.datalake.prodbot.processor.EntityExtractor;
import com.example.datalake.prodbot.processor.IntentAnalyzer;
import com.example.datalake.prodbot.processor.TextPreprocessor;
import com.example.datalake.prodbot.processor.TextProcessor;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the natural-language stages over a query in a fixed order.
 */
@Service
public class QueryPipeline {

  // Explicit, deterministic order; context analysis only needs the normalized text
  private static final List<Class<? extends TextProcessor>> DEFAULT_ORDER = List.of(
          TextPreprocessor.class,
          ContextAnalysisProcessor.class,
          EntityExtractor.class,
          IntentAnalyzer.class
  );

  private final Map<Class<? extends TextProcessor>, TextProcessor> processorsByType;

  public QueryPipeline(List<TextProcessor> processors) {
    // keyed by target class so proxied stages still match DEFAULT_ORDER
    this.processorsByType = processors.stream()
        .collect(Collectors.toMap(
            QueryPipeline::getConcreteType,
            Function.identity(),
            (left, right) -> left,
            LinkedHashMap::new
        ));
  }

  public Mono<QueryContext> run(String query, ConversationContext conversation) {
    QueryContext ctx = new QueryContext()
        .setRawInput(query == null ? "" : query)
        .setConversation(conversation);

    Mono<QueryContext> pipeline = Mono.just(ctx);
    for (TextProcessor processor : buildOrderedChain()) {
      final TextProcessor stage = processor;
      pipeline = pipeline.flatMap(stage::process);
    }
    return pipeline;
  }

  List<TextProcessor> buildOrderedChain() {
    Set<TextProcessor> seen = new LinkedHashSet<>();
    List<TextProcessor> ordered = new ArrayList<>();

    // known stages first
    for (Class<? extends TextProcessor> type : DEFAULT_ORDER) {
      TextProcessor processor = processorsByType.get(type);
      if (processor != null && seen.add(processor)) {
        ordered.add(processor);
      }
    }

    // then extras, as registered
    for (TextProcessor processor : processorsByType.values()) {
      if (seen.add(processor)) {
        ordered.add(processor);
      }
    }

    return ordered;
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends TextProcessor> getConcreteType(TextProcessor p) {
    Class<?> target = AopUtils.getTargetClass(p);
    if (target == null || !TextProcessor.class.isAssignableFrom(target)) {
      target = p.getClass();
    }
    return (Class<? extends TextProcessor>) target;
  }
}
