package com.example.datalake.prodbot.context;

import com.example.datalake.prodbot.model.Intent;

import java.util.List;

public record ConversationState(
    DialogStage dialogStage,
    String activeProductId,
    List<String> mentionedProducts,
    Intent previousIntent,
    int historySize,
    long sessionSeconds) {
}
