package com.example.datalake.prodbot.nlp;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Optional;

/**
 * Sentence embeddings for semantic intent scoring. Empty means no vector is available
 * for this text, and the semantic signal contributes nothing.
 */
public interface EmbeddingProvider {
  String name();
  Optional<Embedding> embed(String text);
}
