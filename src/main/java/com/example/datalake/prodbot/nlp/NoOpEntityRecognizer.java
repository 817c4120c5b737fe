package com.example.datalake.prodbot.nlp;

import com.example.datalake.prodbot.model.Entity;

import java.util.List;

public class NoOpEntityRecognizer implements EntityRecognizer {
  @Override public String name() { return "none"; }

  @Override
  public List<Entity> recognize(String text) {
    return List.of();
  }
}
