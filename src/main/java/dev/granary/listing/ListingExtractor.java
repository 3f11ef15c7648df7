package dev.granary.listing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a listing page into announcement stubs by running an ordered list of {@link
 * ListingStrategy} implementations and keeping the result of the one that yields the most valid
 * candidates. Ties go to the earlier strategy. Fallback strategies are consulted only when no
 * structural strategy found anything.
 *
 * <p>Never throws: unrecognized markup yields an empty list, and rows without a usable title and
 * link are dropped.
 */
@Component
public class ListingExtractor {

  private static final Logger log = LoggerFactory.getLogger(ListingExtractor.class);

  private final List<ListingStrategy> strategies;

  public ListingExtractor() {
    this(
        List.of(
            new TableListingStrategy(),
            new ListItemListingStrategy(),
            new AnchorDateListingStrategy()));
  }

  ListingExtractor(List<ListingStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  /**
   * Extracts listings from a page whose links are already absolute.
   *
   * @param html listing page markup
   * @return valid candidates from the winning strategy
   */
  public List<ListingCandidate> extractListings(String html) {
    return extractListings(html, ListingContext.of(""));
  }

  /**
   * Extracts listings, resolving links against the page URL.
   *
   * @param html listing page markup
   * @param context page URL and optional detail URL template
   * @return valid candidates from the winning strategy, de-duplicated by link
   */
  public List<ListingCandidate> extractListings(String html, ListingContext context) {
    if (html == null || html.isBlank()) {
      return List.of();
    }
    Document document = Jsoup.parse(html, context.pageUrl());

    List<ListingCandidate> best = List.of();
    String bestStrategy = null;
    for (ListingStrategy strategy : strategies) {
      if (strategy.isFallback() && !best.isEmpty()) {
        continue;
      }
      List<ListingCandidate> valid;
      try {
        valid = validOnly(strategy.extract(document, context));
      } catch (RuntimeException e) {
        log.warn(
            "Listing strategy '{}' failed on {}: {}",
            strategy.name(),
            context.pageUrl(),
            e.getMessage());
        continue;
      }
      log.debug("Strategy '{}' found {} valid listings", strategy.name(), valid.size());
      if (valid.size() > best.size()) {
        best = valid;
        bestStrategy = strategy.name();
      }
    }
    if (bestStrategy != null) {
      log.info(
          "Extracted {} listings from {} using '{}'", best.size(), context.pageUrl(), bestStrategy);
    }
    return best;
  }

  private static List<ListingCandidate> validOnly(List<ListingCandidate> candidates) {
    Map<String, ListingCandidate> byLink = new LinkedHashMap<>();
    for (ListingCandidate candidate : candidates) {
      if (candidate.isValid()) {
        byLink.putIfAbsent(candidate.detailLink(), candidate);
      }
    }
    return new ArrayList<>(byLink.values());
  }
}
