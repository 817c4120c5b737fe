package com.example.datalake.prodbot.dialog;

/**
 * Fixed Swedish phrasing used around data-derived content.
 */
public final class ResponseTemplates {

  private ResponseTemplates() {}

  public static final String ERROR = "Något gick fel: {error}";
  public static final String INVALID_PRODUCT = "Ogiltig produkt: {product_id}";

  public static final String TECHNICAL_BEGINNER_INTRO =
      "Här är de viktigaste tekniska egenskaperna för {product_name} i ett förenklat format:";
  public static final String COMPATIBILITY_INTRO =
      "Här är information om vilka produkter som {product_name} fungerar tillsammans med:";
  public static final String NO_TECHNICAL_INFO =
      "Tyvärr hittade jag inga tekniska specifikationer för {product_name}.";
  public static final String NO_COMPATIBILITY_INFO =
      "Tyvärr hittade jag ingen kompatibilitetsinformation för {product_name}.";
  public static final String NO_SUMMARY_INFO =
      "Tyvärr hittade jag ingen sammanfattning för {product_name}.";

  public static final String LOW_CONFIDENCE_DISCLAIMER =
      "Jag är inte helt säker, men jag tror att du frågar om {intent}.";
  public static final String ALTERNATIVE_INTENTS = "Du kanske också ville fråga om {alternatives}?";

  public static final String PRODUCT_CLARIFICATION = "{question}\n\n{options}";
  public static final String INTENT_CLARIFICATION = "{question}\n\n{options}";
  public static final String GENERIC_CLARIFICATION =
      "Jag förstod inte riktigt din fråga. Kan du omformulera den eller vara mer specifik?";

  public static final String QUESTION_WHICH_PRODUCT = "Vilken av dessa produkter menar du?";
  public static final String QUESTION_SUGGESTED_PRODUCT = "Menar du någon av dessa produkter?";
  public static final String QUESTION_WHICH_INTENT = "Vad vill du veta om produkten?";

  public static final String ANALYSIS_ERROR = "Ett fel uppstod vid analys av din fråga: {error}";
  public static final String COMMAND_ERROR = "Fel vid körning av kommando: {error}";
}
