package com.example.datalake.prodbot.controller;

import com.example.datalake.prodbot.context.ConversationState;
import com.example.datalake.prodbot.request.ChatRequest;
import com.example.datalake.prodbot.response.ChatResponse;
import com.example.datalake.prodbot.response.ErrorResponse;
import com.example.datalake.prodbot.service.BotEngine;
import com.example.datalake.prodbot.service.ConversationSessionService;
import com.example.datalake.prodbot.service.EngineStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@RestController
@RequestMapping("/v1/chat")
@RequiredArgsConstructor
@Tag(name = "Chat API", description = "Commands and free-text product questions")
public class ChatController {

    private final ConversationSessionService sessions;
    private final BotEngine engine;

    @PostMapping
    @Operation(
            summary = "Send one chat turn",
            description = "Runs a structured command (-t/-c/-s/-f <product id>) or a natural-language query "
                    + "within the given session. A new session is created when sessionId is omitted."
    )
    public Mono<ResponseEntity<Object>> chat(@Valid @RequestBody ChatRequest req) {
        // engine reads the corpus from disk
        return Mono.fromCallable(() -> sessions.chat(req.getSessionId(), req.getQuery()))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<Object>>map(reply -> ResponseEntity.ok(ChatResponse.of(reply.sessionId(), reply.response())))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while handling chat turn", ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .<Object>body(new ErrorResponse("internal_error", ex.getMessage())));
                });
    }

    @GetMapping("/stats")
    @Operation(summary = "Engine statistics", description = "Query counters, success rate and uptime.")
    public Mono<ResponseEntity<EngineStats>> stats() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(engine.getStats()));
    }

    @GetMapping("/{sessionId}/state")
    @Operation(summary = "Conversation state", description = "Dialog stage, active product and history size of a session.")
    public Mono<ResponseEntity<ConversationState>> state(@PathVariable String sessionId) {
        return Mono.fromSupplier(() -> sessions.state(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @DeleteMapping("/{sessionId}")
    @Operation(summary = "Forget a session")
    public Mono<ResponseEntity<Void>> forget(@PathVariable String sessionId) {
        return Mono.fromSupplier(() -> sessions.forget(sessionId)
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }
}
