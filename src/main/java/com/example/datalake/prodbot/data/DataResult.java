package com.example.datalake.prodbot.data;

import java.util.Optional;

/**
 * Outcome of a corpus read. Missing data ({@link NotFound}) and unreadable data
 * ({@link Failure}) are distinct, and neither is thrown.
 */
public sealed interface DataResult<T> permits DataResult.Success, DataResult.NotFound, DataResult.Failure {

  ResultStatus status();

  /** Rendered markdown for successes, empty otherwise. */
  String formattedText();

  /** Human-readable reason for non-successes, null for successes. */
  String message();

  default boolean isSuccess() {
    return status() == ResultStatus.SUCCESS;
  }

  default Optional<T> value() {
    if (this instanceof Success<T> success) {
      return Optional.ofNullable(success.data());
    }
    return Optional.empty();
  }

  static <T> DataResult<T> success(T data, String formattedText) {
    return new Success<>(data, formattedText);
  }

  static <T> DataResult<T> notFound(String message) {
    return new NotFound<>(message);
  }

  static <T> DataResult<T> failure(String message) {
    return new Failure<>(message);
  }

  record Success<T>(T data, String formattedText) implements DataResult<T> {
    @Override public ResultStatus status() { return ResultStatus.SUCCESS; }
    @Override public String message() { return null; }
  }

  record NotFound<T>(String message) implements DataResult<T> {
    @Override public ResultStatus status() { return ResultStatus.NOT_FOUND; }
    @Override public String formattedText() { return ""; }
  }

  record Failure<T>(String message) implements DataResult<T> {
    @Override public ResultStatus status() { return ResultStatus.FAILURE; }
    @Override public String formattedText() { return ""; }
  }
}
