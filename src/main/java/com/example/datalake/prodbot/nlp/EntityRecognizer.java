package com.example.datalake.prodbot.nlp;

import com.example.datalake.prodbot.model.Entity;

import java.util.List;

/**
 * Statistical named-entity recognition. Implementations map their native labels onto
 * {@link com.example.datalake.prodbot.model.EntityType} and drop anything else.
 */
public interface EntityRecognizer {
  String name();
  List<Entity> recognize(String text);
}
