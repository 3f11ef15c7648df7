package dev.granary.listing;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;

/**
 * Reads listings rendered as {@code li} items or card containers. The longest anchor text in the
 * item is the title; date and organization come from the item's text and labelled children.
 *
 * <p>Items inside site chrome (navigation bars, menus, headers, footers, tabs) are ignored so that
 * long menu labels are not mistaken for announcements.
 */
public class ListItemListingStrategy implements ListingStrategy {

  private static final String ITEM_SELECTOR =
      "li, article, div[class*=card], div[class*=item], div[class*=list_box]";

  private static final Pattern CHROME_MARKER =
      Pattern.compile(
          "gnb|lnb|snb|menu|nav|header|footer|sitemap|quick|util|breadcrumb|location|tab|paging"
              + "|pagination|banner|family");

  private static final String ORGANIZATION_SELECTOR =
      "[class*=org], [class*=agency], [class*=dept], [class*=writer], [class*=institution]";

  @Override
  public String name() {
    return "list";
  }

  @Override
  public List<ListingCandidate> extract(Document document, ListingContext context) {
    List<ListingCandidate> candidates = new ArrayList<>();
    for (Element item : document.select(ITEM_SELECTOR)) {
      if (isSiteChrome(item)) {
        continue;
      }
      Element anchor = titleAnchor(item);
      if (anchor == null) {
        continue;
      }
      String itemText = ListingText.clean(item.text());
      LocalDate date = ListingText.parseDate(itemText);
      candidates.add(
          new ListingCandidate(
              ListingText.clean(anchor.text()),
              context.resolveLink(anchor),
              organizationOf(item),
              date));
    }
    return candidates;
  }

  private static @Nullable Element titleAnchor(Element item) {
    Element best = null;
    int bestLength = 0;
    for (Element anchor : item.select("a[href], a[onclick]")) {
      int length = ListingText.clean(anchor.text()).length();
      if (length > bestLength) {
        best = anchor;
        bestLength = length;
      }
    }
    return best;
  }

  private static @Nullable String organizationOf(Element item) {
    Element labelled = item.selectFirst(ORGANIZATION_SELECTOR);
    if (labelled != null) {
      String text = ListingText.clean(labelled.text());
      if (!text.isEmpty()) {
        return text;
      }
    }
    for (Element span : item.select("span, em, dd, p")) {
      String text = ListingText.clean(span.ownText());
      if (ListingText.looksLikeOrganization(text)) {
        return text;
      }
    }
    return null;
  }

  private static boolean isSiteChrome(Element item) {
    for (Element element = item; element != null; element = element.parent()) {
      String tag = element.normalName();
      if ("nav".equals(tag) || "header".equals(tag) || "footer".equals(tag)) {
        return true;
      }
      String marker = (element.id() + " " + element.className()).toLowerCase(Locale.ROOT);
      if (!marker.isBlank() && CHROME_MARKER.matcher(marker).find()) {
        return true;
      }
    }
    return false;
  }
}
