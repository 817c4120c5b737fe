package com.example.datalake.prodbot.util;

import java.util.HashSet;
import java.util.Set;

public final class TokenSimilarity {

  private TokenSimilarity() {}

  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) return 0.0;
    return (double) overlap(a, b) / union(a, b);
  }

  public static int overlap(Set<String> a, Set<String> b) {
    Set<String> inter = new HashSet<>(a);
    inter.retainAll(b);
    return inter.size();
  }

  private static int union(Set<String> a, Set<String> b) {
    Set<String> all = new HashSet<>(a);
    all.addAll(b);
    return all.size();
  }
}
