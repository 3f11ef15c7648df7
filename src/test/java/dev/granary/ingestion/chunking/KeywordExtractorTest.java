package dev.granary.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class KeywordExtractorTest {

  @Test
  void tokensAreLowercasedStrippedAndDistinct() {
    Set<String> keywords =
        KeywordExtractor.extractKeywords("청년 창업 지원 및 The Startup, startup! (R&D)");

    assertThat(keywords).containsExactly("청년", "창업", "지원", "startup", "rd");
  }

  @Test
  void stopWordsAndSingleCharactersAreDropped() {
    Set<String> keywords = KeywordExtractor.extractKeywords("a 것 x 수출 or 바우처 에서");

    assertThat(keywords).containsExactly("수출", "바우처");
  }

  @Test
  void keywordSetIsCapped() {
    String text =
        IntStream.range(0, 80).mapToObj(i -> "kw" + i).collect(Collectors.joining(" "));

    Set<String> keywords = KeywordExtractor.extractKeywords(text);

    assertThat(keywords).hasSize(KeywordExtractor.MAX_KEYWORDS);
    assertThat(keywords).startsWith("kw0").contains("kw49").doesNotContain("kw50");
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {" ", "!!! ..."})
  void emptyInputHasNoKeywords(String text) {
    assertThat(KeywordExtractor.extractKeywords(text)).isEmpty();
  }
}
