package com.example.datalake.prodbot.dialog;

import static com.example.datalake.prodbot.data.CorpusFixture.LASHUS;
import static com.example.datalake.prodbot.data.CorpusFixture.STOLPE;
import static com.example.datalake.prodbot.data.CorpusFixture.TRYCKE;
import static org.junit.jupiter.api.Assertions.*;

import com.example.datalake.prodbot.config.BotProperties;
import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ContextUpdate;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.data.CorpusFixture;
import com.example.datalake.prodbot.data.DataResult;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.model.ClarificationOption;
import com.example.datalake.prodbot.model.ClarificationQuestion;
import com.example.datalake.prodbot.model.CommandType;
import com.example.datalake.prodbot.model.ExpertiseLevel;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.IntentScore;
import com.example.datalake.prodbot.model.QueryAnalysis;
import com.example.datalake.prodbot.model.QueryType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResponseGeneratorTest {

  @TempDir Path dir;

  private final ContextManager contextManager = new ContextManager();
  private ProductDataManager data;
  private ResponseGenerator generator;

  @BeforeEach
  void setUp() {
    data = CorpusFixture.standard(dir).dataManager();
    generator = new ResponseGenerator(BotProperties.offline(dir.toString()), data);
  }

  private ConversationContext contextWith(String... queries) {
    ConversationContext ctx = new ConversationContext();
    for (String q : queries) {
      contextManager.updateContext(ctx, ContextUpdate.query(q));
    }
    return ctx;
  }

  private ConversationContext expert() {
    ConversationContext ctx = contextWith("hej");
    contextManager.updateContext(ctx, ContextUpdate.builder().expertiseLevel(ExpertiseLevel.EXPERT).build());
    return ctx;
  }

  private static QueryAnalysis analysis(double confidence, IntentScore... scores) {
    List<IntentScore> intents = List.of(scores);
    return new QueryAnalysis("fråga", "fråga", List.of(), intents, intents.get(0).intent(), confidence,
        QueryType.INDEPENDENT, List.of(), Map.of(), Map.of(), List.of());
  }

  // ====== commands ======

  @Test
  void technicalCommand_usesConfiguredTemplate() {
    String text = generator.formatCommandResponse(CommandType.TECHNICAL, LASHUS, data.getTechnicalSpecs(LASHUS, null));

    assertEquals("# Tekniska specifikationer för Låshus 310-50\n\n**Artikelnummer:** 50091812\n\n"
        + "## Dimensioner\n- **Height:** 10 mm\n\n## Elektriska\n- **Voltage:** 220 V", text);
  }

  @Test
  void compatibilityCommand_usesConfiguredTemplate() {
    String text = generator.formatCommandResponse(CommandType.COMPATIBILITY, LASHUS,
        data.getCompatibilityInfo(LASHUS, null));

    assertTrue(text.startsWith("# Kompatibilitetsinformation för Låshus 310-50\n\n**Artikelnummer:** 50091812"));
    assertTrue(text.endsWith("## Kräver\n- Trycke Oslo"));
  }

  @Test
  void summaryAndFullInfoCommands() {
    DataResult<?> summary = data.getProductSummary(STOLPE);
    assertEquals(summary.formattedText(), generator.formatCommandResponse(CommandType.SUMMARY, STOLPE, summary));

    DataResult<?> full = data.getFullInfo(LASHUS);
    assertEquals(full.formattedText(), generator.formatCommandResponse(CommandType.FULL_INFO, LASHUS, full));
  }

  @Test
  void commandOnMissingData_isAnError() {
    String text = generator.formatCommandResponse(CommandType.TECHNICAL, STOLPE, data.getTechnicalSpecs(STOLPE, null));
    assertEquals("Något gick fel: Inga tekniska specifikationer tillgängliga", text);
  }

  // ====== natural language ======

  @Test
  void technical_forBeginner_isFlatAndSimplified() {
    String text = generator.generateNlResponse(Intent.TECHNICAL, LASHUS,
        data.getTechnicalSpecs(LASHUS, null), contextWith("hej"));

    assertEquals("Här är de viktigaste tekniska egenskaperna för Låshus 310-50 i ett förenklat format:\n\n"
        + "- **Height:** 10 mm\n- **Voltage:** 220 V", text);
  }

  @Test
  void technical_forExpert_isCategorized() {
    String text = generator.generateNlResponse(Intent.TECHNICAL, LASHUS, data.getTechnicalSpecs(LASHUS, null), expert());

    assertTrue(text.startsWith("# Tekniska specifikationer för Låshus 310-50"));
    assertTrue(text.contains("## Dimensioner"));
  }

  @Test
  void compatibility_depthFollowsExpertise() {
    DataResult<?> result = data.getCompatibilityInfo(LASHUS, null);

    String beginner = generator.generateNlResponse(Intent.COMPATIBILITY, LASHUS, result, contextWith("hej"));
    assertTrue(beginner.startsWith("Här är information om vilka produkter som Låshus 310-50 fungerar tillsammans med:"));
    assertTrue(beginner.endsWith("- Passar till: Monteringsstolpe MS-1 (Art.nr: 50012345)\n- Kräver: Trycke Oslo"));

    String intermediate = generator.generateNlResponse(Intent.COMPATIBILITY, LASHUS, result, new ConversationContext());
    assertTrue(intermediate.contains("## Passar till"));

    String expert = generator.generateNlResponse(Intent.COMPATIBILITY, LASHUS, result, expert());
    assertTrue(expert.startsWith("# Kompatibilitetsinformation för Låshus 310-50"));
  }

  @Test
  void missingData_getsApologeticText() {
    assertEquals("Tyvärr hittade jag ingen kompatibilitetsinformation för Monteringsstolpe MS-1.",
        generator.generateNlResponse(Intent.COMPATIBILITY, STOLPE, data.getCompatibilityInfo(STOLPE, null),
            new ConversationContext()));
    assertEquals("Tyvärr hittade jag inga tekniska specifikationer för Trycke Oslo.",
        generator.generateNlResponse(Intent.TECHNICAL, TRYCKE, data.getTechnicalSpecs(TRYCKE, null),
            new ConversationContext()));
  }

  @Test
  void failures_areReportedAsErrors() {
    String text = generator.generateNlResponse(Intent.SUMMARY, LASHUS, DataResult.failure("disk borta"),
        new ConversationContext());
    assertEquals("Något gick fel: disk borta", text);
  }

  @Test
  void search_forExpert_isATable() {
    String text = generator.generateNlResponse(Intent.SEARCH, null, data.searchProducts("låshus"), expert());

    assertTrue(text.contains("| 1 | Låshus 310-50 | 50091812 | 1.00 | exakt |"));
  }

  // ====== expertise ======

  @Test
  void expertise_isInferredFromHistory() {
    assertEquals(ExpertiseLevel.INTERMEDIATE, generator.inferExpertise(new ConversationContext()));
    assertEquals(ExpertiseLevel.BEGINNER, generator.inferExpertise(contextWith("hej")));
    assertEquals(ExpertiseLevel.INTERMEDIATE, generator.inferExpertise(contextWith("Visa dimensioner och material")));
    assertEquals(ExpertiseLevel.INTERMEDIATE, generator.inferExpertise(contextWith("a", "b", "c")));
    assertEquals(ExpertiseLevel.EXPERT, generator.inferExpertise(contextWith("teknisk specifikation med tolerans")));
    assertEquals(ExpertiseLevel.EXPERT, generator.inferExpertise(expert()));
  }

  @Test
  void simplify_replacesJargon() {
    assertEquals("mått och passar tillsammans med", ResponseGenerator.simplify("Dimensioner och Kompatibilitet"));
    assertEquals("Monteringsstolpe", ResponseGenerator.simplify("Monteringsstolpe"));
  }

  // ====== uncertainty ======

  @Test
  void lowConfidence_wrapsResponseWithDisclaimerAndAlternatives() {
    QueryAnalysis analysis = analysis(0.5,
        new IntentScore(Intent.SUMMARY, 0.5),
        new IntentScore(Intent.TECHNICAL, 0.4),
        new IntentScore(Intent.SEARCH, 0.3),
        new IntentScore(Intent.COMPATIBILITY, 0.1));

    assertEquals("Jag är inte helt säker, men jag tror att du frågar om produktsammanfattning.\n\nSVAR\n\n"
            + "Du kanske också ville fråga om tekniska specifikationer, produktsökning?",
        generator.formatLowConfidenceResponse(analysis, "SVAR"));
  }

  @Test
  void lowConfidence_withoutAlternatives() {
    QueryAnalysis analysis = analysis(0.5, new IntentScore(Intent.TECHNICAL, 0.5));

    assertEquals("Jag är inte helt säker, men jag tror att du frågar om tekniska specifikationer.\n\nSVAR",
        generator.formatLowConfidenceResponse(analysis, "SVAR"));
  }

  @Test
  void clarification_listsOptions() {
    ClarificationQuestion products = new ClarificationQuestion(ClarificationQuestion.Type.PRODUCT_SELECTION,
        ResponseTemplates.QUESTION_WHICH_PRODUCT,
        List.of(new ClarificationOption(LASHUS, "Låshus 310-50"), new ClarificationOption(TRYCKE, "Trycke Oslo")));
    assertEquals("Vilken av dessa produkter menar du?\n\n- Låshus 310-50 (Art.nr: 50091812)\n- Trycke Oslo (Art.nr: 50077777)",
        generator.formatClarificationRequest(List.of(products)));

    ClarificationQuestion intents = new ClarificationQuestion(ClarificationQuestion.Type.INTENT_SELECTION,
        ResponseTemplates.QUESTION_WHICH_INTENT,
        List.of(new ClarificationOption("technical", "Tekniska specifikationer"),
            new ClarificationOption("search", "Sök efter produkter")));
    assertEquals("Vad vill du veta om produkten?\n\n- Tekniska specifikationer\n- Sök efter produkter",
        generator.formatClarificationRequest(List.of(intents)));

    assertEquals(ResponseTemplates.GENERIC_CLARIFICATION, generator.formatClarificationRequest(List.of()));
  }
}
