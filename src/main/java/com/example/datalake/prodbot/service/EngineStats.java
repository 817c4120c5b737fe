package com.example.datalake.prodbot.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EngineStats(
    @JsonProperty("total_queries") long totalQueries,
    @JsonProperty("successful_queries") long successfulQueries,
    @JsonProperty("command_queries") long commandQueries,
    @JsonProperty("natural_language_queries") long naturalLanguageQueries,
    @JsonProperty("ambiguous_queries") long ambiguousQueries,
    @JsonProperty("failures") long failures,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("uptime_seconds") long uptimeSeconds) {
}
