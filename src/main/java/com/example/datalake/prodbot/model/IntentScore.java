package com.example.datalake.prodbot.model;

public record IntentScore(Intent intent, double score) {
}
