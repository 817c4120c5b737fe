package com.example.datalake.prodbot.config;

import com.example.datalake.prodbot.nlp.EmbeddingProvider;
import com.example.datalake.prodbot.nlp.EntityRecognizer;
import com.example.datalake.prodbot.nlp.LangChain4jEmbeddingProvider;
import com.example.datalake.prodbot.nlp.NoOpEmbeddingProvider;
import com.example.datalake.prodbot.nlp.NoOpEntityRecognizer;
import com.example.datalake.prodbot.nlp.OpenNlpEntityRecognizer;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import opennlp.tools.namefind.TokenNameFinderModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Model-backed NLP capabilities. Anything that cannot be loaded is replaced by its no-op
 * counterpart and reported once here.
 */
@Slf4j
@Configuration
public class NlpModelConfig {

    @Bean
    public EntityRecognizer entityRecognizer(BotProperties props) {
        if (!props.useNlp()) {
            log.info("NLP disabled, entity recognition uses patterns and the product index only");
            return new NoOpEntityRecognizer();
        }
        if (props.nerModel().isEmpty()) {
            log.warn("No NER model configured (prodbot.ner-model), statistical entity recognition is off");
            return new NoOpEntityRecognizer();
        }
        Path path = Path.of(props.nerModel());
        try (InputStream in = Files.newInputStream(path)) {
            TokenNameFinderModel model = new TokenNameFinderModel(in);
            log.info("Loaded NER model from {}", path);
            return new OpenNlpEntityRecognizer(model);
        } catch (IOException ex) {
            log.warn("Could not load NER model from {}: {}. Statistical entity recognition is off", path, ex.toString());
            return new NoOpEntityRecognizer();
        }
    }

    @Bean
    public EmbeddingProvider embeddingProvider(BotProperties props) {
        if (!props.useNlp() || BotProperties.EMBEDDINGS_NONE.equalsIgnoreCase(props.embeddingsModel())) {
            log.info("Embeddings disabled, semantic intent scoring is off");
            return new NoOpEmbeddingProvider();
        }
        if (!BotProperties.EMBEDDINGS_MINILM.equalsIgnoreCase(props.embeddingsModel())) {
            log.warn("Unknown embeddings model '{}', semantic intent scoring is off", props.embeddingsModel());
            return new NoOpEmbeddingProvider();
        }
        try {
            return new LangChain4jEmbeddingProvider(new AllMiniLmL6V2EmbeddingModel(), BotProperties.EMBEDDINGS_MINILM);
        } catch (RuntimeException | LinkageError ex) {
            log.warn("Could not load embeddings model '{}': {}. Semantic intent scoring is off",
                    props.embeddingsModel(), ex.toString());
            return new NoOpEmbeddingProvider();
        }
    }
}
