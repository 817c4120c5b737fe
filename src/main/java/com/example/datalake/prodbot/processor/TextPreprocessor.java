package com.example.datalake.prodbot.processor;

import com.example.datalake.prodbot.model.QueryContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Canonical text form for the rest of the pipeline: single spaces, NFKD, collapsed
 * dashes and dots, straight quotes.
 */
@Component
public class TextPreprocessor implements TextProcessor {
  @Override public String name() { return "text-preprocessor"; }

  // ====== Precompiled patterns ======
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern REPEATED_DASH = Pattern.compile("-{2,}");
  private static final Pattern REPEATED_DOT = Pattern.compile("\\.{2,}");
  private static final Pattern DOUBLE_QUOTES = Pattern.compile("[“”„‟«»]");
  private static final Pattern SINGLE_QUOTES = Pattern.compile("[‘’‚‛`´]");

  @Override
  public Mono<QueryContext> process(QueryContext ctx) {
    String raw = ctx.getRawInput() == null ? "" : ctx.getRawInput();
    String normalized = preprocess(raw);
    ctx.setNormalized(normalized);
    return Mono.just(ctx.addStep(name(), "chars=" + raw.length() + "->" + normalized.length()));
  }

  public static String preprocess(String text) {
    if (text == null) return "";
    String t = WHITESPACE.matcher(text).replaceAll(" ").trim();
    t = Normalizer.normalize(t, Normalizer.Form.NFKD);
    t = REPEATED_DASH.matcher(t).replaceAll("-");
    t = REPEATED_DOT.matcher(t).replaceAll("...");
    t = DOUBLE_QUOTES.matcher(t).replaceAll("\"");
    t = SINGLE_QUOTES.matcher(t).replaceAll("'");
    return t;
  }
}
