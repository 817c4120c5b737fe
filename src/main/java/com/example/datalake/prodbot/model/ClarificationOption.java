package com.example.datalake.prodbot.model;

public record ClarificationOption(String id, String text) {
}
