package com.example.datalake.prodbot.data;

public record SearchMatch(String productId, String name, double score, MatchType matchType) {

  public enum MatchType { EXACT, FUZZY }
}
