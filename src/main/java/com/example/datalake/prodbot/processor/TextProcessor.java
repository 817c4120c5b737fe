package com.example.datalake.prodbot.processor;

import com.example.datalake.prodbot.model.QueryContext;
import reactor.core.publisher.Mono;

public interface TextProcessor {
    String name();
    Mono<QueryContext> process(QueryContext ctx);
}
