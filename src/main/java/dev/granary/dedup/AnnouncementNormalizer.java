package dev.granary.dedup;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Computes announcement fingerprints.
 *
 * <p>Names lose year markers, round markers ({@code 제2차}, {@code 3회차}, {@code 5기}),
 * bracketed content, a leading {@code 사업} and trailing {@code 공고}/{@code 모집}/{@code 안내},
 * then all punctuation and whitespace. The program year is put back as a prefix so the same
 * program in different years stays distinct. Organizations lose legal-form affixes and known
 * abbreviations are expanded.
 */
public final class AnnouncementNormalizer {

  private static final Pattern YEAR = Pattern.compile("(?<!\\d)(20\\d{2})(?!\\d)");
  private static final Pattern SHORT_YEAR = Pattern.compile("'(\\d{2})\\s*년");

  private static final Pattern[] YEAR_MARKERS = {
    Pattern.compile("[(\\[]\\s*20\\d{2}\\s*[)\\]]"),
    Pattern.compile("(?<!\\d)20\\d{2}\\s*년도?"),
    Pattern.compile("'\\d{2}\\s*년도?"),
    Pattern.compile("(?<!\\d)20\\d{2}(?!\\d)")
  };

  private static final Pattern[] ROUND_MARKERS = {
    Pattern.compile("제?\\s*\\d+\\s*차"),
    Pattern.compile("\\d+\\s*회차?"),
    Pattern.compile("\\d+\\s*기")
  };

  private static final Pattern BRACKETED = Pattern.compile("\\([^)]*\\)|\\[[^\\]]*\\]");
  private static final Pattern SPECIAL_BRACKETS = Pattern.compile("[『』「」【】〈〉《》<>]");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern LEADING_BUSINESS = Pattern.compile("^사업\\s*");
  private static final Pattern[] TRAILING_WORDS = {
    Pattern.compile("\\s*공고$"), Pattern.compile("\\s*모집$"), Pattern.compile("\\s*안내$")
  };

  private static final Pattern ORG_AFFIXES =
      Pattern.compile(
          "\\(재\\)|\\(사\\)|\\(주\\)|㈜|재단법인|사단법인|주식회사"
              + "|co\\.,?\\s*ltd\\.?|\\b(?:inc|corp|ltd)\\b\\.?");

  private static final Map<String, String> ORG_SYNONYMS =
      Map.of(
          "중기부", "중소벤처기업부",
          "중소기업벤처부", "중소벤처기업부",
          "중진공", "중소벤처기업진흥공단",
          "창진원", "창업진흥원",
          "소진공", "소상공인시장진흥공단",
          "산업부", "산업통상자원부",
          "과기정통부", "과학기술정보통신부");

  private AnnouncementNormalizer() {
    // utility class
  }

  public static Fingerprint normalize(String name, @Nullable String organization) {
    return new Fingerprint(normalizeName(name), normalizeOrganization(organization));
  }

  /**
   * Normalizes an announcement title.
   *
   * @return the normalized name, prefixed with {@code year:} when a year is present
   */
  public static String normalizeName(String name) {
    if (name == null) {
      return "";
    }
    String text = name.toLowerCase(Locale.ROOT);
    Integer year = extractYear(text);
    for (Pattern marker : YEAR_MARKERS) {
      text = marker.matcher(text).replaceAll(" ");
    }
    for (Pattern marker : ROUND_MARKERS) {
      text = marker.matcher(text).replaceAll(" ");
    }
    text = BRACKETED.matcher(text).replaceAll(" ");
    text = SPECIAL_BRACKETS.matcher(text).replaceAll(" ");
    text = NON_ALPHANUMERIC.matcher(text).replaceAll(" ").strip();
    text = LEADING_BUSINESS.matcher(text).replaceFirst("");
    for (Pattern trailing : TRAILING_WORDS) {
      text = trailing.matcher(text).replaceFirst("");
    }
    text = NON_ALPHANUMERIC.matcher(text).replaceAll("");
    return year != null ? year + ":" + text : text;
  }

  /**
   * Normalizes an issuing organization.
   *
   * @return the normalized organization, empty when none is given
   */
  public static String normalizeOrganization(@Nullable String organization) {
    if (organization == null || organization.isBlank()) {
      return "";
    }
    String text = organization.toLowerCase(Locale.ROOT);
    text = ORG_AFFIXES.matcher(text).replaceAll(" ");
    text = NON_ALPHANUMERIC.matcher(text).replaceAll("");
    return ORG_SYNONYMS.getOrDefault(text, text);
  }

  /**
   * Finds the program year: the largest {@code 20xx} in the text, or a short {@code 'yy년}
   * form.
   *
   * @return the year, or null when none is present
   */
  public static @Nullable Integer extractYear(String text) {
    Integer best = null;
    Matcher m = YEAR.matcher(text);
    while (m.find()) {
      best = max(best, Integer.parseInt(m.group(1)));
    }
    Matcher shortYear = SHORT_YEAR.matcher(text);
    while (shortYear.find()) {
      best = max(best, 2000 + Integer.parseInt(shortYear.group(1)));
    }
    return best;
  }

  private static Integer max(@Nullable Integer current, int candidate) {
    return current == null || candidate > current ? candidate : current;
  }
}
