package com.example.datalake.prodbot.processor;

import static org.junit.jupiter.api.Assertions.*;

import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ContextUpdate;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntitySource;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.IntentAnalysis;
import com.example.datalake.prodbot.model.IntentScore;
import com.example.datalake.prodbot.nlp.KeywordVectorEmbeddingProvider;
import com.example.datalake.prodbot.nlp.NoOpEmbeddingProvider;
import com.example.datalake.prodbot.util.TextFolding;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntentAnalyzerTest {

  private final IntentAnalyzer keywordsOnly = new IntentAnalyzer(new NoOpEmbeddingProvider());
  private final IntentAnalyzer withVectors = new IntentAnalyzer(new KeywordVectorEmbeddingProvider());

  private static final List<Entity> LASHUS_WITH_MARKER = List.of(
      Entity.builder().type(EntityType.COMPATIBILITY).text("passar till").start(4).end(15)
          .confidence(0.85).source(EntitySource.REGEX).build(),
      Entity.builder().type(EntityType.PRODUCT).text("Låshus 310-50").start(16).end(29)
          .confidence(0.9).source(EntitySource.PRODUCT_INDEX).productId("50091812").build());

  @Test
  void vagueSingleWord_yieldsLowSummaryConfidence() {
    IntentAnalysis analysis = keywordsOnly.analyzeIntent("info", List.of(), new ConversationContext());

    assertEquals(Intent.SUMMARY, analysis.primaryIntent());
    // 0.35*0.1 + 0.25*0.2 + 0.10*0.1 = 0.095, close runner-up scales it by 0.8
    assertEquals(0.076, analysis.confidence(), 1e-9);
    assertEquals(4, analysis.intents().size());
  }

  @Test
  void compatibilityQuestion_aboutKnownProduct_isConfidentCompatibility() {
    String text = TextPreprocessor.preprocess("Vad passar till Låshus 310-50?");

    IntentAnalysis analysis = withVectors.analyzeIntent(text, LASHUS_WITH_MARKER, new ConversationContext());

    assertEquals(Intent.COMPATIBILITY, analysis.primaryIntent());
    assertTrue(analysis.confidence() >= 0.6, "confidence was " + analysis.confidence());
    assertEquals(List.of("passar", "passar till"), analysis.matchedKeywords().get(Intent.COMPATIBILITY));
  }

  @Test
  void analysis_isDeterministic() {
    String text = TextPreprocessor.preprocess("Vad passar till Låshus 310-50?");
    ConversationContext conversation = new ConversationContext();

    IntentAnalysis first = withVectors.analyzeIntent(text, LASHUS_WITH_MARKER, conversation);
    IntentAnalysis second = withVectors.analyzeIntent(text, LASHUS_WITH_MARKER, conversation);

    assertEquals(first.primaryIntent(), second.primaryIntent());
    assertEquals(first.confidence(), second.confidence());
    assertEquals(first.intents(), second.intents());
  }

  @Test
  void intentsAreRankedHighestFirst() {
    IntentAnalysis analysis = withVectors.analyzeIntent(
        TextPreprocessor.preprocess("Vad passar till Låshus 310-50?"), LASHUS_WITH_MARKER, new ConversationContext());

    List<IntentScore> ranked = analysis.intents();
    for (int i = 1; i < ranked.size(); i++) {
      assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score());
    }
  }

  @Test
  void previousTechnicalTurn_favoursTechnical() {
    ConversationContext conversation = new ConversationContext();
    new ContextManager().updateContext(conversation,
        ContextUpdate.builder().query("Vilka mått har låshuset?").intent(Intent.TECHNICAL).build());

    IntentAnalysis analysis = keywordsOnly.analyzeIntent("och bredden?", List.of(), conversation);

    assertEquals(0.3, analysis.contextScores().get(Intent.TECHNICAL), 1e-9);
    assertEquals(0.0, analysis.contextScores().get(Intent.SUMMARY), 1e-9);
  }

  @Test
  void summaryLean_onlyAppliesToAnEmptyHistory() {
    IntentAnalysis fresh = keywordsOnly.analyzeIntent("och bredden?", List.of(), new ConversationContext());
    assertEquals(0.1, fresh.contextScores().get(Intent.SUMMARY), 1e-9);

    // earlier turns that never settled on an intent, e.g. only clarifications
    ConversationContext unresolved = new ConversationContext();
    new ContextManager().updateContext(unresolved, ContextUpdate.query("info"));
    assertNull(unresolved.getPreviousIntent());

    IntentAnalysis later = keywordsOnly.analyzeIntent("och bredden?", List.of(), unresolved);
    for (Intent intent : Intent.values()) {
      assertEquals(0.0, later.contextScores().get(intent), 1e-9, intent.code());
    }
  }

  @Test
  void dimensions_pushTechnical() {
    List<Entity> dims = List.of(
        Entity.builder().type(EntityType.DIMENSION).text("25 mm").start(0).end(5).confidence(0.85)
            .source(EntitySource.REGEX).build());

    IntentAnalysis analysis = keywordsOnly.analyzeIntent("25 mm", dims, new ConversationContext());

    assertEquals(0.2, analysis.entityScores().get(Intent.TECHNICAL), 1e-9);
  }

  @Test
  void mentionedProperty_skipsGenericTechnicalWords() {
    IntentAnalysis analysis = keywordsOnly.analyzeIntent(
        TextPreprocessor.preprocess("Teknisk info: vilken vikt och spänning har den?"), List.of(), new ConversationContext());

    assertEquals(Intent.TECHNICAL, analysis.primaryIntent());
    assertEquals("vikt", IntentAnalyzer.mentionedProperty(analysis).orElseThrow());
    assertTrue(analysis.matchedKeywords().get(Intent.TECHNICAL).contains(TextFolding.fold("spänning")));
  }

  @Test
  void adjustConfidence_penalisesCloseRunnerUp_andRewardsClearWinner() {
    assertEquals(0.4, IntentAnalyzer.adjustConfidence(scores(0.5, 0.45), 0.5), 1e-9);
    assertEquals(0.55, IntentAnalyzer.adjustConfidence(scores(0.5, 0.1), 0.5), 1e-9);
    assertEquals(0.5, IntentAnalyzer.adjustConfidence(scores(0.5, 0.3), 0.5), 1e-9);
    assertEquals(1.0, IntentAnalyzer.adjustConfidence(scores(0.95, 0.1), 0.95), 1e-9);
    assertEquals(0.2, IntentAnalyzer.adjustConfidence(scores(0.2, 0.2), 0.2), 1e-9);
  }

  private static List<IntentScore> scores(double first, double second) {
    return List.of(new IntentScore(Intent.SUMMARY, first), new IntentScore(Intent.TECHNICAL, second));
  }
}
