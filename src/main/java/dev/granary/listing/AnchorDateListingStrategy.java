package dev.granary.listing;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;

/**
 * Last-resort strategy: any anchor whose surrounding block (up to a few ancestors) contains a
 * date-like substring is treated as an announcement link.
 */
public class AnchorDateListingStrategy implements ListingStrategy {

  static final int MAX_ANCESTOR_DEPTH = 3;

  @Override
  public String name() {
    return "anchor-date";
  }

  @Override
  public boolean isFallback() {
    return true;
  }

  @Override
  public List<ListingCandidate> extract(Document document, ListingContext context) {
    List<ListingCandidate> candidates = new ArrayList<>();
    for (Element anchor : document.select("a[href]")) {
      String title = ListingText.clean(anchor.text());
      if (title.length() < ListingCandidate.MIN_TITLE_LENGTH) {
        continue;
      }
      LocalDate date = nearbyDate(anchor);
      if (date != null) {
        candidates.add(new ListingCandidate(title, context.resolveLink(anchor), null, date));
      }
    }
    return candidates;
  }

  private static @Nullable LocalDate nearbyDate(Element anchor) {
    Element block = anchor.parent();
    for (int depth = 0; block != null && depth < MAX_ANCESTOR_DEPTH; depth++) {
      if ("body".equals(block.normalName())) {
        return null;
      }
      LocalDate date = ListingText.parseDate(block.text());
      if (date != null) {
        return date;
      }
      block = block.parent();
    }
    return null;
  }
}
