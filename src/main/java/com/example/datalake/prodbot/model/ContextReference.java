package com.example.datalake.prodbot.model;

/**
 * An anaphor found in the query. {@code resolution} is null when session state had
 * nothing to point it at.
 */
public record ContextReference(ReferenceType type, String text, int start, int end, ResolvedReference resolution) {

  public boolean isResolved() {
    return resolution != null;
  }
}
