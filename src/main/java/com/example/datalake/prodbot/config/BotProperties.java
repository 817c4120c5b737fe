package com.example.datalake.prodbot.config;

import com.example.datalake.prodbot.data.ProductTextFormatter;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine settings bound from {@code prodbot.*}.
 *
 * @param dataDir                corpus root containing {@code products/} and {@code indices/}
 * @param useNlp                 master switch for the statistical models
 * @param nerModel               path to an OpenNLP name finder model, empty for none
 * @param embeddingsModel        in-process embedding model id, or {@code none}
 * @param minConfidence          below this the engine does not trust the primary intent
 * @param clarificationThreshold below this the engine asks instead of guessing
 * @param maxSearchResults       result cap for product search
 * @param responseCacheSize      max cached command responses, 0 disables the cache
 * @param sessionTimeout         idle time before a chat session is dropped
 * @param maxSessions            live chat sessions kept before the least recently used is evicted
 * @param responseTemplates      per-intent templates keyed technical/compatibility/summary
 */
@Validated
@ConfigurationProperties(prefix = "prodbot")
public record BotProperties(
        @NotBlank @DefaultValue("integrated_data") String dataDir,
        @DefaultValue("true") boolean useNlp,
        String nerModel,
        @DefaultValue(EMBEDDINGS_MINILM) String embeddingsModel,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.6") double minConfidence,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.4") double clarificationThreshold,
        @Min(1) @DefaultValue("5") int maxSearchResults,
        @Min(0) @DefaultValue("1000") long responseCacheSize,
        @DefaultValue("30m") Duration sessionTimeout,
        @Min(1) @DefaultValue("10000") long maxSessions,
        Map<String, String> responseTemplates) {

    public static final String EMBEDDINGS_MINILM = "all-minilm-l6-v2";
    public static final String EMBEDDINGS_NONE = "none";
    public static final long DEFAULT_MAX_SESSIONS = 10_000;

    public static final String TEMPLATE_TECHNICAL = "technical";
    public static final String TEMPLATE_COMPATIBILITY = "compatibility";
    public static final String TEMPLATE_SUMMARY = "summary";

    public static final Map<String, String> DEFAULT_TEMPLATES = Map.of(
            TEMPLATE_TECHNICAL,
            "# Tekniska specifikationer för {product_name}\n\n**Artikelnummer:** {product_id}\n\n{specifications}",
            TEMPLATE_COMPATIBILITY,
            "# Kompatibilitetsinformation för {product_name}\n\n**Artikelnummer:** {product_id}\n\n{compatibility}",
            TEMPLATE_SUMMARY,
            ProductTextFormatter.SUMMARY_LAYOUT
    );

    public BotProperties {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("prodbot.min-confidence must be within [0,1]: " + minConfidence);
        }
        if (clarificationThreshold < 0.0 || clarificationThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "prodbot.clarification-threshold must be within [0,1]: " + clarificationThreshold);
        }
        if (clarificationThreshold > minConfidence) {
            throw new IllegalArgumentException("prodbot.clarification-threshold (" + clarificationThreshold
                    + ") must not exceed prodbot.min-confidence (" + minConfidence + ")");
        }
        if (maxSearchResults < 1) {
            throw new IllegalArgumentException("prodbot.max-search-results must be positive: " + maxSearchResults);
        }
        if (responseCacheSize < 0) {
            throw new IllegalArgumentException("prodbot.response-cache-size must not be negative");
        }
        if (maxSessions < 1) {
            throw new IllegalArgumentException("prodbot.max-sessions must be positive: " + maxSessions);
        }
        nerModel = nerModel == null ? "" : nerModel.trim();
        embeddingsModel = embeddingsModel == null || embeddingsModel.isBlank() ? EMBEDDINGS_NONE : embeddingsModel.trim();
        sessionTimeout = sessionTimeout == null ? Duration.ofMinutes(30) : sessionTimeout;

        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_TEMPLATES);
        if (responseTemplates != null) {
            responseTemplates.forEach((k, v) -> {
                if (v != null && !v.isBlank()) merged.put(k, v);
            });
        }
        responseTemplates = Map.copyOf(merged);
    }

    /**
     * Defaults with NLP models switched off, for wiring outside a Spring context.
     */
    public static BotProperties offline(String dataDir) {
        return new BotProperties(dataDir, false, "", EMBEDDINGS_NONE, 0.6, 0.4, 5, 1000,
                Duration.ofMinutes(30), DEFAULT_MAX_SESSIONS, Map.of());
    }

    public String template(String key) {
        return responseTemplates.getOrDefault(key, "");
    }
}
