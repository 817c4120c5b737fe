package com.example.datalake.prodbot.data;

import com.example.datalake.prodbot.util.TextFolding;

import java.util.Map;

/** Swedish display labels for compatibility relation types. */
public final class RelationLabels {

  private static final Map<String, String> LABELS = Map.ofEntries(
      Map.entry("direct", "Kompatibel med"),
      Map.entry("compatible_with", "Kompatibel med"),
      Map.entry("fits", "Passar till"),
      Map.entry("requires", "Kräver"),
      Map.entry("recommended", "Rekommenderas med"),
      Map.entry("designed_for", "Designad för"),
      Map.entry("accessory", "Tillbehör till"),
      Map.entry("replacement", "Ersätter"),
      Map.entry("replaced_by", "Ersätts av"),
      Map.entry("not_compatible", "Ej kompatibel med")
  );

  private RelationLabels() {}

  public static String label(String relationType) {
    if (relationType == null || relationType.isBlank()) return "Övrigt";
    String known = LABELS.get(relationType);
    return known != null ? known : TextFolding.titleCase(relationType.replace('_', ' '));
  }
}
