package com.example.datalake.prodbot.processor;

import static com.example.datalake.prodbot.data.CorpusFixture.LASHUS;
import static com.example.datalake.prodbot.data.CorpusFixture.LASHUS_NAME;
import static com.example.datalake.prodbot.data.CorpusFixture.TRYCKE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.example.datalake.prodbot.context.ContextManager;
import com.example.datalake.prodbot.context.ContextUpdate;
import com.example.datalake.prodbot.context.ConversationContext;
import com.example.datalake.prodbot.data.CorpusFixture;
import com.example.datalake.prodbot.data.ProductDataManager;
import com.example.datalake.prodbot.model.Entity;
import com.example.datalake.prodbot.model.EntitySource;
import com.example.datalake.prodbot.model.EntityType;
import com.example.datalake.prodbot.model.QueryContext;
import com.example.datalake.prodbot.nlp.EntityRecognizer;
import com.example.datalake.prodbot.nlp.NoOpEntityRecognizer;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntityExtractorTest {

  @TempDir Path dir;

  private ProductDataManager data;
  private EntityExtractor extractor;

  @BeforeEach
  void setUp() {
    data = CorpusFixture.standard(dir).dataManager();
    extractor = new EntityExtractor(new NoOpEntityRecognizer(), data);
  }

  private List<Entity> extract(String raw) {
    return extractor.extractEntities(TextPreprocessor.preprocess(raw), new ConversationContext());
  }

  private static List<Entity> ofType(List<Entity> entities, EntityType type) {
    return entities.stream().filter(e -> e.getType() == type).toList();
  }

  @Test
  void productName_isMatchedFromDictionary_evenWithDecomposedInput() {
    List<Entity> entities = extract("Vad passar till Låshus 310-50?");

    List<Entity> products = ofType(entities, EntityType.PRODUCT);
    assertEquals(1, products.size());
    assertEquals(LASHUS, products.get(0).getProductId());
    assertEquals(EntitySource.PRODUCT_INDEX, products.get(0).getSource());
    assertEquals(0.9, products.get(0).getConfidence(), 1e-9);

    List<Entity> markers = ofType(entities, EntityType.COMPATIBILITY);
    assertEquals(1, markers.size());
    assertEquals("passar till", markers.get(0).getText());
  }

  @Test
  void productName_withInflectedSuffix_isStillMatched() {
    List<Entity> genitive = ofType(extract("Trycke Oslos handtag"), EntityType.PRODUCT);
    assertEquals(1, genitive.size());
    assertEquals(TRYCKE, genitive.get(0).getProductId());
    assertEquals(EntitySource.PRODUCT_INDEX, genitive.get(0).getSource());

    List<Entity> definite = ofType(extract("Hur monteras låshus 310-50an?"), EntityType.PRODUCT);
    assertEquals(1, definite.size());
    assertEquals(LASHUS, definite.get(0).getProductId());
  }

  @Test
  void eightDigitNumber_namingAProductDirectory_resolvesToThatProduct() {
    List<Entity> entities = extract("Visa 50091812");

    assertEquals(1, entities.size());
    Entity e = entities.get(0);
    assertEquals(EntityType.PRODUCT, e.getType());
    assertEquals(LASHUS, e.getProductId());
    assertEquals(EntitySource.REGEX, e.getSource());
  }

  @Test
  void unknownArticleNumber_staysUnresolved_andLabelledFormsMergeIntoOne() {
    List<Entity> entities = extract("art.nr 12345678");

    assertEquals(1, entities.size());
    assertEquals(EntityType.ARTICLE_NUMBER, entities.get(0).getType());
    assertEquals("12345678", entities.get(0).getText());
    assertFalse(entities.get(0).isResolved());
  }

  @Test
  void validEan_resolvesThroughIndex_invalidChecksumIsDropped() {
    List<Entity> valid = extract("EAN 4006381333931");
    assertEquals(1, valid.size());
    assertEquals(EntityType.PRODUCT, valid.get(0).getType());
    assertEquals(LASHUS, valid.get(0).getProductId());

    assertTrue(extract("EAN 4006381333930").isEmpty());
  }

  @Test
  void dimensionsAreExtractedWithUnit() {
    List<Entity> dims = ofType(extract("Finns den i 25 mm bredd?"), EntityType.DIMENSION);

    assertEquals(1, dims.size());
    assertEquals("25 mm", dims.get(0).getText());
    assertEquals(0.85, dims.get(0).getConfidence(), 1e-9);
  }

  @Test
  void anaphor_withActiveProduct_addsContextualProduct() {
    ConversationContext conversation = new ConversationContext();
    new ContextManager().updateContext(conversation, ContextUpdate.builder().productId(LASHUS).build());

    List<Entity> entities = extractor.extractEntities(TextPreprocessor.preprocess("Hur tung är den?"), conversation);

    assertEquals(1, entities.size());
    Entity e = entities.get(0);
    assertTrue(e.isContextualReference());
    assertFalse(e.isPositioned());
    assertEquals(LASHUS, e.getProductId());
    assertEquals(LASHUS_NAME, e.getText());
    assertEquals(EntitySource.CONTEXT, e.getSource());
  }

  @Test
  void anaphor_withoutActiveProduct_addsNothing() {
    assertTrue(extract("Hur tung är den?").isEmpty());
  }

  @Test
  void recognizerProducts_areResolvedByName() {
    EntityRecognizer recognizer = mock(EntityRecognizer.class);
    String text = TextPreprocessor.preprocess("Har ni Trycke Oslo?");
    when(recognizer.recognize(anyString())).thenReturn(List.of(Entity.builder()
        .type(EntityType.PRODUCT).text("Trycke Oslo").start(7).end(18)
        .confidence(0.8).source(EntitySource.NER).build()));

    List<Entity> entities = new EntityExtractor(recognizer, data).extractEntities(text, new ConversationContext());

    List<Entity> products = ofType(entities, EntityType.PRODUCT);
    assertEquals(1, products.size());
    assertEquals(TRYCKE, products.get(0).getProductId());
  }

  @Test
  void failingRecognizer_fallsBackToPatterns() {
    EntityRecognizer recognizer = mock(EntityRecognizer.class);
    when(recognizer.name()).thenReturn("broken");
    when(recognizer.recognize(anyString())).thenThrow(new IllegalStateException("model not loaded"));

    List<Entity> entities = new EntityExtractor(recognizer, data).extractEntities("Visa 50091812", new ConversationContext());

    assertEquals(1, entities.size());
    assertEquals(LASHUS, entities.get(0).getProductId());
  }

  @Test
  void mergeOverlapping_keepsMostConfident_andIsIdempotent() {
    Entity contextual = Entity.builder().type(EntityType.PRODUCT).text(LASHUS_NAME).start(-1).end(-1)
        .confidence(0.8).source(EntitySource.CONTEXT).productId(LASHUS).contextualReference(true).build();
    Entity article = Entity.builder().type(EntityType.ARTICLE_NUMBER).text("50091812").start(0).end(8)
        .confidence(0.9).source(EntitySource.REGEX).build();
    Entity named = Entity.builder().type(EntityType.PRODUCT).text("50091812").start(0).end(8)
        .confidence(0.95).source(EntitySource.NER).build();
    Entity dimension = Entity.builder().type(EntityType.DIMENSION).text("25 mm").start(20).end(25)
        .confidence(0.85).source(EntitySource.REGEX).build();

    List<Entity> once = EntityExtractor.mergeOverlapping(List.of(dimension, article, contextual, named));

    assertEquals(List.of(contextual, named, dimension), once);
    assertEquals(once, EntityExtractor.mergeOverlapping(once));
  }

  @Test
  void process_storesEntities_andRecordsStep() {
    QueryContext ctx = new QueryContext()
        .setRawInput("Visa 50091812")
        .setNormalized("Visa 50091812")
        .setConversation(new ConversationContext());

    QueryContext out = extractor.process(ctx).block();

    assertNotNull(out);
    assertEquals(1, out.getEntities().size());
    assertEquals("entity-extractor", out.getSteps().get(0).getName());
  }
}
