package com.example.datalake.prodbot.util;

import static org.junit.jupiter.api.Assertions.*;

import java.text.Normalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextFoldingTest {

  @Test
  void fold_isIdempotent_andMatchesDecomposedInput() {
    String composed = "Låshus";
    String decomposed = Normalizer.normalize(composed, Normalizer.Form.NFKD);
    assertEquals(TextFolding.fold(composed), TextFolding.fold(decomposed));
    assertEquals(TextFolding.fold(composed), TextFolding.fold(TextFolding.fold(composed)));
  }

  @Test
  void words_keepHyphenatedTokensTogether() {
    assertEquals(List.of("låshus", "310-50", "passar"),
        TextFolding.words("Låshus 310-50, passar?").stream()
            .map(w -> Normalizer.normalize(w, Normalizer.Form.NFC))
            .toList());
  }

  @Test
  void termPattern_onlyMatchesWholeWords() {
    assertTrue(TextFolding.termPattern("det").matcher("vad väger det?").find());
    assertFalse(TextFolding.termPattern("det").matcher("detaljer").find());
    assertTrue(TextFolding.termPattern("dom här").matcher(TextFolding.fold("Passar dom här?")).find());
  }

  @Test
  void titleCase_capitalizesEachWord() {
    assertEquals("Designed For", TextFolding.titleCase("designed for"));
    assertEquals("", TextFolding.titleCase(" "));
  }
}
