package com.example.datalake.prodbot.nlp;

import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntitySource;
import com.example.datalake.prodbot.model.EntityType;
import lombok.extern.slf4j.Slf4j;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Name finder backed by an OpenNLP {@link TokenNameFinderModel}. {@link NameFinderME} keeps
 * adaptive state between calls, so recognition is serialized.
 */
@Slf4j
public class OpenNlpEntityRecognizer implements EntityRecognizer {

  static final double CONFIDENCE = 0.8;

  private static final Map<String, EntityType> LABELS = Map.of(
      "product", EntityType.PRODUCT,
      "org", EntityType.PRODUCT,
      "organization", EntityType.PRODUCT,
      "work_of_art", EntityType.PRODUCT,
      "ean", EntityType.EAN,
      "dimension", EntityType.DIMENSION,
      "quantity", EntityType.DIMENSION,
      "compatibility", EntityType.COMPATIBILITY
  );

  private final NameFinderME finder;

  public OpenNlpEntityRecognizer(TokenNameFinderModel model) {
    this.finder = new NameFinderME(model);
  }

  @Override public String name() { return "opennlp"; }

  @Override
  public synchronized List<Entity> recognize(String text) {
    if (text == null || text.isBlank()) return List.of();

    Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
    String[] tokens = Span.spansToStrings(tokenSpans, text);
    Span[] names = finder.find(tokens);
    finder.clearAdaptiveData();

    List<Entity> out = new ArrayList<>(names.length);
    for (Span span : names) {
      EntityType type = LABELS.get(span.getType() == null ? "" : span.getType().toLowerCase(Locale.ROOT));
      if (type == null) {
        log.debug("[{}] ignoring label={}", name(), span.getType());
        continue;
      }
      int start = tokenSpans[span.getStart()].getStart();
      int end = tokenSpans[span.getEnd() - 1].getEnd();
      out.add(Entity.builder()
          .type(type)
          .text(text.substring(start, end))
          .start(start)
          .end(end)
          .confidence(CONFIDENCE)
          .source(EntitySource.NER)
          .build());
    }
    return out;
  }
}
