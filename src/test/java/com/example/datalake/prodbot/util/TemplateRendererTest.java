package com.example.datalake.prodbot.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

  @Test
  void fillsKnownKeys_andBlanksUnknownOnes() {
    String out = TemplateRenderer.render("# {product_name} ({product_id}){missing}",
        Map.of("product_name", "Låshus", "product_id", "50091812"));
    assertEquals("# Låshus (50091812)", out);
  }

  @Test
  void valuesWithDollarSignsAreInsertedLiterally() {
    assertEquals("pris: $5", TemplateRenderer.render("pris: {p}", Map.of("p", "$5")));
  }
}
