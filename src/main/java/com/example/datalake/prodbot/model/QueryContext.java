package com.example.datalake.prodbot.model;

import com.example.datalake.prodbot.context.ConversationContext;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state threaded through the query pipeline. Each stage fills in its own part
 * and records a step; {@link QueryAnalysis#from(QueryContext)} freezes the result.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class QueryContext {
  // input
  private String rawInput;
  private ConversationContext conversation;

  // stage outputs
  private String normalized;
  private ContextAnalysis contextAnalysis = ContextAnalysis.independent();
  private List<Entity> entities = new ArrayList<>();
  private IntentAnalysis intentAnalysis;

  // audit trail
  private Instant startedAt = Instant.now();
  private List<StepLog> steps = new ArrayList<>();

  public QueryContext addStep(String name, String note) {
    Instant now = Instant.now();
    steps.add(new StepLog()
        .setName(name)
        .setNote(note)
        .setAt(now)
        .setElapsedMs(Duration.between(startedAt, now).toMillis()));
    return this;
  }

  /** Text later stages should work on: the normalized form once available. */
  public String text() {
    if (normalized != null) return normalized;
    return rawInput == null ? "" : rawInput;
  }
}
