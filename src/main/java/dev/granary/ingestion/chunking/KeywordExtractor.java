package dev.granary.ingestion.chunking;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts the keyword set used by the keyword half of hybrid search: lowercased tokens with
 * punctuation removed, stop-words and single characters dropped, distinct, in first-seen order,
 * at most {@link #MAX_KEYWORDS}.
 */
public final class KeywordExtractor {

  public static final int MAX_KEYWORDS = 50;

  private static final Pattern STRIPPED = Pattern.compile("[^\\p{L}\\p{N}\\s]");

  static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "from", "is", "are", "was", "be", "this", "that", "이", "그", "저", "것", "등", "및", "와",
          "과", "의", "를", "을", "에", "에서", "으로", "또는");

  private KeywordExtractor() {
    // utility class
  }

  public static Set<String> extractKeywords(String text) {
    Set<String> keywords = new LinkedHashSet<>();
    if (text == null || text.isBlank()) {
      return keywords;
    }
    String cleaned = STRIPPED.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    for (String token : cleaned.split("\\s+")) {
      if (token.length() > 1 && !STOP_WORDS.contains(token)) {
        keywords.add(token);
        if (keywords.size() == MAX_KEYWORDS) {
          break;
        }
      }
    }
    return keywords;
  }
}
