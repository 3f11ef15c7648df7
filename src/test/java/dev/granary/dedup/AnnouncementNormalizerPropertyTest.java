package dev.granary.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/**
 * Invariants of {@link AnnouncementNormalizer#normalizeName} over generated titles. Words are drawn
 * from syllables that cannot form the stripped suffixes ({@code 공고}, {@code 모집}, {@code 안내})
 * or the leading {@code 사업}.
 */
class AnnouncementNormalizerPropertyTest {

  private static final String SYLLABLES = "청년창업지원스마트혁신글로벌수출바우처기술";

  @Provide
  Arbitrary<List<String>> words() {
    return Arbitraries.strings()
        .withChars(SYLLABLES.toCharArray())
        .ofMinLength(1)
        .ofMaxLength(6)
        .list()
        .ofMinSize(1)
        .ofMaxSize(5);
  }

  @Provide
  Arbitrary<String> separators() {
    return Arbitraries.of(" ", "  ", "·", "-", ", ", "/");
  }

  @Property
  void normalizationIsIdempotent(@ForAll("words") List<String> words) {
    String once = AnnouncementNormalizer.normalizeName(String.join(" ", words));

    assertThat(AnnouncementNormalizer.normalizeName(once)).isEqualTo(once);
  }

  @Property
  void separatorsDoNotMatter(
      @ForAll("words") List<String> words, @ForAll("separators") String separator) {
    assertThat(AnnouncementNormalizer.normalizeName(String.join(separator, words)))
        .isEqualTo(AnnouncementNormalizer.normalizeName(String.join(" ", words)));
  }

  @Property
  void yearBecomesPrefix(
      @ForAll("words") List<String> words, @ForAll @IntRange(min = 2000, max = 2099) int year) {
    String title = String.join(" ", words);

    assertThat(AnnouncementNormalizer.normalizeName(year + "년 " + title + " 공고"))
        .isEqualTo(year + ":" + AnnouncementNormalizer.normalizeName(title));
  }

  @Property
  void resultHoldsOnlyLettersDigitsAndYearSeparator(
      @ForAll("words") List<String> words, @ForAll("separators") String separator) {
    String title = "[공지] " + String.join(separator, words);

    assertThat(AnnouncementNormalizer.normalizeName(title)).matches("(\\d{4}:)?[\\p{L}\\p{N}]*");
  }
}
