package dev.granary.listing;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Text helpers shared by the listing strategies. */
final class ListingText {

  static final Pattern DATE =
      Pattern.compile("(20\\d{2})\\s*[-./년]\\s*(\\d{1,2})\\s*[-./월]\\s*(\\d{1,2})");

  private static final List<String> ORGANIZATION_MARKERS =
      List.of("부", "청", "원", "공단", "재단", "센터", "진흥", "테크노파크", "협회", "위원회", "시청", "도청");

  private static final int MAX_ORGANIZATION_LENGTH = 40;

  private ListingText() {
    // utility class
  }

  /** Collapses runs of whitespace (including non-breaking spaces) and trims. */
  static String clean(@Nullable String text) {
    if (text == null) {
      return "";
    }
    return text.replace('\u00a0', ' ').replaceAll("\\s+", " ").strip();
  }

  /**
   * Finds the first date-like substring.
   *
   * @return the parsed date, or null when none is present or the digits are not a real date
   */
  static @Nullable LocalDate parseDate(@Nullable String text) {
    if (text == null) {
      return null;
    }
    Matcher matcher = DATE.matcher(text);
    while (matcher.find()) {
      int year = Integer.parseInt(matcher.group(1));
      int month = Integer.parseInt(matcher.group(2));
      int day = Integer.parseInt(matcher.group(3));
      boolean valid =
          month >= 1 && month <= 12 && day >= 1 && day <= YearMonth.of(year, month).lengthOfMonth();
      if (valid) {
        return LocalDate.of(year, month, day);
      }
    }
    return null;
  }

  static boolean containsDate(@Nullable String text) {
    return parseDate(text) != null;
  }

  /** Heuristic: short text naming a ministry, agency or foundation. */
  static boolean looksLikeOrganization(String text) {
    if (text.length() < 2 || text.length() > MAX_ORGANIZATION_LENGTH || containsDate(text)) {
      return false;
    }
    if (text.chars().allMatch(ch -> Character.isDigit(ch) || ch == ',' || ch == '.')) {
      return false;
    }
    return ORGANIZATION_MARKERS.stream().anyMatch(text::contains);
  }
}
