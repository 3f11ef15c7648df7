package dev.granary.listing;

import java.util.List;
import org.jsoup.nodes.Document;

/**
 * One way of reading announcement stubs out of a listing page. Implementations are pure functions
 * of the parsed document: they must not mutate it and must not throw for unfamiliar markup.
 */
public interface ListingStrategy {

  /** Short label used in logs. */
  String name();

  /**
   * Fallback strategies only run when every structural strategy came back empty.
   *
   * @return true for a last-resort strategy
   */
  default boolean isFallback() {
    return false;
  }

  /**
   * Extracts candidates, valid or not. Invalid candidates are filtered by {@link ListingExtractor}.
   *
   * @param document the parsed listing page, with its base URI set to the page URL
   * @param context link resolution context
   * @return candidates in document order; empty when the layout is not recognized
   */
  List<ListingCandidate> extract(Document document, ListingContext context);
}
