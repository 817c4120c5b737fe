package com.example.datalake.prodbot.dialog;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;

import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.data.SearchMatch;
import com.example.datalake.prodbot.model.ClarificationOption;
import com.example.datalake.prodbot.model.ClarificationQuestion;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntitySource;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.IntentScore;
import com.example.datalake.prodbot.model.QueryAnalysis;
import com.example.datalake.prodbot.model.QueryType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClarificationBuilderTest {

  private ProductDataManager data;
  private ClarificationBuilder builder;

  @BeforeEach
  void setUp() {
    data = mock(ProductDataManager.class);
    when(data.getProductName("A")).thenReturn("Låshus A");
    when(data.getProductName("B")).thenReturn("Låshus B");
    builder = new ClarificationBuilder(data);
  }

  private static Entity product(String text, String productId) {
    return Entity.builder()
        .type(EntityType.PRODUCT)
        .text(text)
        .start(0)
        .end(text.length())
        .confidence(0.9)
        .source(EntitySource.PRODUCT_INDEX)
        .productId(productId)
        .build();
  }

  private static QueryAnalysis analysis(double confidence, Entity... entities) {
    return new QueryAnalysis("fråga", "fråga", List.of(entities),
        List.of(new IntentScore(Intent.SUMMARY, confidence)), Intent.SUMMARY, confidence,
        QueryType.INDEPENDENT, List.of(), Map.of(), Map.of(), List.of());
  }

  private ClarificationQuestion single(QueryAnalysis analysis) {
    List<ClarificationQuestion> questions = builder.build(analysis);
    assertEquals(1, questions.size());
    return questions.get(0);
  }

  @Test
  void severalProducts_askWhichOne() {
    ClarificationQuestion q = single(analysis(0.2, product("låshus a", "A"), product("låshus b", "B")));

    assertEquals(ClarificationQuestion.Type.PRODUCT_SELECTION, q.type());
    assertEquals(ResponseTemplates.QUESTION_WHICH_PRODUCT, q.question());
    assertEquals(List.of(new ClarificationOption("A", "Låshus A"), new ClarificationOption("B", "Låshus B")),
        q.options());
  }

  @Test
  void sameProductTwice_isNotAChoice() {
    ClarificationQuestion q = single(analysis(0.35, product("låshus a", "A"), product("den", "A")));

    assertEquals(ClarificationQuestion.Type.GENERAL_CLARIFICATION, q.type());
    assertTrue(q.options().isEmpty());
  }

  @Test
  void unresolvedMention_offersSuggestions() {
    when(data.suggestProducts("stolpe", ClarificationBuilder.MAX_SUGGESTIONS))
        .thenReturn(List.of(new SearchMatch("S", "Monteringsstolpe MS-1", 0.27, SearchMatch.MatchType.FUZZY)));

    ClarificationQuestion q = single(analysis(0.2, product("stolpe", null)));

    assertEquals(ClarificationQuestion.Type.PRODUCT_SUGGESTION, q.type());
    assertEquals(List.of(new ClarificationOption("S", "Monteringsstolpe MS-1")), q.options());
  }

  @Test
  void unresolvedMentionWithoutSuggestions_fallsThroughToIntentMenu() {
    ClarificationQuestion q = single(analysis(0.2, product("xyzzy", null)));

    assertEquals(ClarificationQuestion.Type.INTENT_SELECTION, q.type());
    assertEquals(List.of("technical", "compatibility", "summary", "search"),
        q.options().stream().map(ClarificationOption::id).toList());
    assertEquals("Allmän produktinformation", q.options().get(2).text());
  }

  @Test
  void vagueIntentAboveMenuThreshold_asksToRephrase() {
    ClarificationQuestion q = single(analysis(0.35));

    assertEquals(ClarificationQuestion.Type.GENERAL_CLARIFICATION, q.type());
    assertEquals(ResponseTemplates.GENERIC_CLARIFICATION, q.question());
    verify(data, never()).suggestProducts(anyString(), anyInt());
  }
}
