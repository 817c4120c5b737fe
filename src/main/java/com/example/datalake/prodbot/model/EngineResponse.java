package com.example.datalake.prodbot.model;

import com.example.datalake.prodbot.data.DataResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What the engine hands back for every input, successful or not.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EngineResponse {
  ResponseStatus status;
  ResponseKind kind;
  String message;

  // command branch
  String command;
  String productId;
  String params;
  boolean cached;

  // natural-language branch
  QueryAnalysis analysis;
  Intent intent;
  Double confidence;
  @Singular
  List<ClarificationQuestion> clarificationQuestions;
  @Singular
  List<IntentScore> alternativeIntents;

  @JsonIgnore
  DataResult<?> result;

  @Builder.Default
  Instant timestamp = Instant.now();

  public boolean isSuccess() {
    return status == ResponseStatus.SUCCESS;
  }
}
