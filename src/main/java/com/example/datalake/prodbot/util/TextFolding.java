package com.example.datalake.prodbot.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared comparison form for queries, keyword tables and index keys.
 * Queries are NFKD-normalized by the preprocessor, so every table they are matched
 * against has to be folded the same way.
 */
public final class TextFolding {

  private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{M}\\p{N}]+(?:-[\\p{L}\\p{M}\\p{N}]+)*");

  private TextFolding() {}

  /** NFKD + lower case. Idempotent. */
  public static String fold(String text) {
    if (text == null) return "";
    return Normalizer.normalize(text, Normalizer.Form.NFKD).toLowerCase(Locale.ROOT);
  }

  /** Folded word tokens in order. */
  public static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    Matcher m = WORD.matcher(fold(text));
    while (m.find()) {
      out.add(m.group());
    }
    return out;
  }

  public static Set<String> wordSet(String text) {
    return new LinkedHashSet<>(words(text));
  }

  /**
   * Pattern matching the folded {@code term} only at word boundaries. Apply it to folded text.
   */
  public static Pattern termPattern(String term) {
    return Pattern.compile("(?<![\\p{L}\\p{M}\\p{N}])" + Pattern.quote(fold(term)) + "(?![\\p{L}\\p{M}\\p{N}])");
  }

  /** Capitalizes the first letter of each space-separated word. */
  public static String titleCase(String text) {
    if (text == null || text.isBlank()) return "";
    StringBuilder sb = new StringBuilder(text.length());
    boolean start = true;
    for (char c : text.toCharArray()) {
      if (Character.isWhitespace(c)) {
        start = true;
        sb.append(c);
      } else if (start) {
        sb.append(Character.toUpperCase(c));
        start = false;
      } else {
        sb.append(Character.toLowerCase(c));
      }
    }
    return sb.toString();
  }
}
