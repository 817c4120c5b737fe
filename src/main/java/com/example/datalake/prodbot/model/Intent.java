package com.example.datalake.prodbot.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Intent {
  TECHNICAL("tekniska specifikationer", "Tekniska specifikationer"),
  COMPATIBILITY("kompatibilitetsinformation", "Kompatibilitetsinformation"),
  SUMMARY("produktsammanfattning", "Allmän produktinformation"),
  SEARCH("produktsökning", "Sök efter produkter");

  private final String displayName;
  private final String menuLabel;

  Intent(String displayName, String menuLabel) {
    this.displayName = displayName;
    this.menuLabel = menuLabel;
  }

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Swedish name used in disclaimers and suggestions. */
  public String displayName() {
    return displayName;
  }

  /** Label shown in the intent-selection menu. */
  public String menuLabel() {
    return menuLabel;
  }
}
