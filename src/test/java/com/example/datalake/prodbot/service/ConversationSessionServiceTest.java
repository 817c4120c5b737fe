package com.example.datalake.prodbot.service;

import static com.example.datalake.prodbot.data.CorpusFixture.LASHUS;
import static org.junit.jupiter.api.Assertions.*;

import com.example.datalake.prodbot.config.BotProperties;
import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ConversationState;
import com.example.datalake.prodbot.context.DialogStage;
import com.example.datalake.prodbot.data.CorpusFixture;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.dialog.ClarificationBuilder;
import com.example.datalake.prodbot.dialog.ResponseGenerator;
import com.example.datalake.prodbot.model.Intent;
import com.example.datalake.prodbot.model.ResponseStatus;
import com.example.datalake.prodbot.nlp.NoOpEmbeddingProvider;
import com.example.datalake.prodbot.nlp.NoOpEntityRecognizer;
import com.example.datalake.prodbot.processor.ContextAnalysisProcessor;
import com.example.datalake.prodbot.processor.EntityExtractor;
import com.example.datalake.prodbot.processor.IntentAnalyzer;
import com.example.datalake.prodbot.processor.TextPreprocessor;
import com.example.datalake.prodbot.service.ConversationSessionService.SessionReply;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversationSessionServiceTest {

  @TempDir Path dir;

  private ConversationSessionService sessions;

  @BeforeEach
  void setUp() {
    ProductDataManager data = CorpusFixture.standard(dir).dataManager();
    BotProperties props = BotProperties.offline(dir.toString());
    ContextManager contextManager = new ContextManager();
    QueryPipeline pipeline = new QueryPipeline(List.of(
        new TextPreprocessor(),
        new ContextAnalysisProcessor(contextManager),
        new EntityExtractor(new NoOpEntityRecognizer(), data),
        new IntentAnalyzer(new NoOpEmbeddingProvider())));
    BotEngine engine = new BotEngine(props, pipeline, data, contextManager,
        new ResponseGenerator(props, data), new ClarificationBuilder(data),
        Caffeine.newBuilder().maximumSize(10).build());
    sessions = new ConversationSessionService(engine, contextManager, Caffeine.newBuilder().build());
  }

  @Test
  void blankSessionId_startsANewSession() {
    SessionReply first = sessions.chat(null, "-t 50091812");
    SessionReply second = sessions.chat(" ", "-t 50091812");

    assertNotNull(first.sessionId());
    assertNotEquals(first.sessionId(), second.sessionId());
    assertEquals(ResponseStatus.SUCCESS, first.response().getStatus());
  }

  @Test
  void stateIsKeptPerSession() {
    sessions.chat("a", "-c 50091812");
    sessions.chat("b", "info");

    ConversationState a = sessions.state("a").orElseThrow();
    assertEquals(LASHUS, a.activeProductId());
    assertEquals(Intent.COMPATIBILITY, a.previousIntent());
    assertEquals(DialogStage.DETAILED_INQUIRY, a.dialogStage());
    assertEquals(1, a.historySize());

    ConversationState b = sessions.state("b").orElseThrow();
    assertNull(b.activeProductId());
    assertEquals(DialogStage.SEARCH, b.dialogStage());
  }

  @Test
  void forgottenSessionsAreGone() {
    sessions.chat("a", "-s 50012345");

    assertTrue(sessions.forget("a"));
    assertTrue(sessions.state("a").isEmpty());
    assertFalse(sessions.forget("a"));
  }
}
