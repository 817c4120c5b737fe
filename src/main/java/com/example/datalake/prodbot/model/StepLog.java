package com.example.datalake.prodbot.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class StepLog {
  private String name;
  private String note;
  private Instant at;
  /**
   * Elapsed milliseconds since the QueryContext was created when this step was recorded.
   */
  private Long elapsedMs;
}
