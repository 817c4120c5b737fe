package com.example.datalake.prodbot.nlp;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel model;
  private final String modelName;

  public LangChain4jEmbeddingProvider(EmbeddingModel model, String modelName) {
    this.model = model;
    this.modelName = modelName;
  }

  @Override public String name() { return modelName; }

  @Override
  public Optional<Embedding> embed(String text) {
    if (text == null || text.isBlank()) return Optional.empty();
    try {
      return Optional.ofNullable(model.embed(text).content());
    } catch (RuntimeException ex) {
      log.debug("[{}] embedding failed: {}", modelName, ex.toString());
      return Optional.empty();
    }
  }
}
