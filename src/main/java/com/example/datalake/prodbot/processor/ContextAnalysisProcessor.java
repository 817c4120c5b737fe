package com.example.datalake.prodbot.processor;

import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.model.ContextAnalysis;
import com.example.datalake.prodbot.model.QueryContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@RequiredArgsConstructor
public class ContextAnalysisProcessor implements TextProcessor {

  private final ContextManager contextManager;

  @Override public String name() { return "context-analysis"; }

  @Override
  public Mono<QueryContext> process(QueryContext ctx) {
    ConversationContext conversation = ctx.getConversation() == null ? new ConversationContext() : ctx.getConversation();
    ContextAnalysis analysis = contextManager.analyzeContext(ctx.text(), conversation);
    ctx.setContextAnalysis(analysis);

    long resolved = analysis.references().stream().filter(r -> r.isResolved()).count();
    log.info("[{}] type={} refs={} resolved={}", name(), analysis.queryType().code(),
        analysis.references().size(), resolved);
    return Mono.just(ctx.addStep(name(),
        "type=" + analysis.queryType().code() + ", refs=" + analysis.references().size() + ", resolved=" + resolved));
  }
}
