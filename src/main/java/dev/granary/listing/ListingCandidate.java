package dev.granary.listing;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * An announcement stub found on a listing page.
 *
 * @param title announcement title as shown in the listing
 * @param detailLink absolute URL of the detail page; null when the row had no resolvable link
 * @param organization issuing organization when the layout exposes one
 * @param date posting date when the layout exposes one
 */
public record ListingCandidate(
    String title,
    @Nullable String detailLink,
    @Nullable String organization,
    @Nullable LocalDate date) {

  /** Titles shorter than this are navigation labels, not announcements. */
  public static final int MIN_TITLE_LENGTH = 5;

  /**
   * Whether the candidate has a usable title and link.
   *
   * @return true if the title has at least {@link #MIN_TITLE_LENGTH} characters and a link is set
   */
  public boolean isValid() {
    return title != null
        && title.strip().length() >= MIN_TITLE_LENGTH
        && detailLink != null
        && !detailLink.isBlank();
  }
}
