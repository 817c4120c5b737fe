package com.example.datalake.prodbot.nlp;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Optional;

public class NoOpEmbeddingProvider implements EmbeddingProvider {
  @Override public String name() { return "none"; }

  @Override
  public Optional<Embedding> embed(String text) {
    return Optional.empty();
  }
}
