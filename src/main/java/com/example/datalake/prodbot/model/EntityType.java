package com.example.datalake.prodbot.model;

public enum EntityType {
  PRODUCT,
  ARTICLE_NUMBER,
  EAN,
  DIMENSION,
  COMPATIBILITY
}
