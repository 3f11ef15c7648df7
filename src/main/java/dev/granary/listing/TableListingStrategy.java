package dev.granary.listing;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jspecify.annotations.Nullable;

/**
 * Reads board-style listings rendered as an HTML table: one row per announcement with number,
 * title, organization and date columns in site-specific order.
 *
 * <p>The data table is the one with the most data rows. Header rows (only {@code th} cells) and
 * pinned notice rows are skipped. The title comes from the first cell holding an anchor and enough
 * text; organization and date are guessed from the other cells.
 */
public class TableListingStrategy implements ListingStrategy {

  static final Set<String> NOTICE_SENTINELS = Set.of("공지", "[공지]", "공지사항", "notice", "필독");

  @Override
  public String name() {
    return "table";
  }

  @Override
  public List<ListingCandidate> extract(Document document, ListingContext context) {
    Element table = findDataTable(document);
    if (table == null) {
      return List.of();
    }
    List<ListingCandidate> candidates = new ArrayList<>();
    for (Element row : table.select("tr")) {
      List<Element> cells = cellsOf(row);
      if (cells.size() < 2 || isHeaderRow(cells) || isNoticeRow(row, cells)) {
        continue;
      }
      ListingCandidate candidate = readRow(cells, context);
      if (candidate != null) {
        candidates.add(candidate);
      }
    }
    return candidates;
  }

  private @Nullable ListingCandidate readRow(List<Element> cells, ListingContext context) {
    int titleIndex = -1;
    Element anchor = null;
    for (int i = 0; i < cells.size(); i++) {
      Element cell = cells.get(i);
      Element candidateAnchor = cell.selectFirst("a[href], a[onclick]");
      if (candidateAnchor != null
          && ListingText.clean(cell.text()).length() >= ListingCandidate.MIN_TITLE_LENGTH) {
        titleIndex = i;
        anchor = candidateAnchor;
        break;
      }
    }
    if (anchor == null) {
      return null;
    }
    String title = ListingText.clean(anchor.text());
    if (title.length() < ListingCandidate.MIN_TITLE_LENGTH) {
      title = ListingText.clean(cells.get(titleIndex).text());
    }

    String organization = null;
    LocalDate date = null;
    for (int i = 0; i < cells.size(); i++) {
      if (i == titleIndex) {
        continue;
      }
      String text = ListingText.clean(cells.get(i).text());
      if (date == null) {
        date = ListingText.parseDate(text);
      }
      if (organization == null && ListingText.looksLikeOrganization(text)) {
        organization = text;
      }
    }
    return new ListingCandidate(title, context.resolveLink(anchor), organization, date);
  }

  private static @Nullable Element findDataTable(Document document) {
    Element best = null;
    int bestRows = 0;
    for (Element table : document.select("table")) {
      int dataRows = 0;
      for (Element row : table.select("tr")) {
        if (row.select("td").size() >= 2) {
          dataRows++;
        }
      }
      if (dataRows > bestRows) {
        best = table;
        bestRows = dataRows;
      }
    }
    return best;
  }

  private static List<Element> cellsOf(Element row) {
    List<Element> cells = new ArrayList<>();
    for (Element child : row.children()) {
      if ("td".equals(child.normalName()) || "th".equals(child.normalName())) {
        cells.add(child);
      }
    }
    return cells;
  }

  private static boolean isHeaderRow(List<Element> cells) {
    return cells.stream().allMatch(cell -> "th".equals(cell.normalName()));
  }

  private static boolean isNoticeRow(Element row, List<Element> cells) {
    String rowClass = row.className().toLowerCase(Locale.ROOT);
    if (rowClass.contains("notice") || rowClass.contains("fixed")) {
      return true;
    }
    Element first = cells.get(0);
    String firstText = ListingText.clean(first.text()).toLowerCase(Locale.ROOT);
    if (NOTICE_SENTINELS.contains(firstText)) {
      return true;
    }
    Elements icons = first.select("img[alt]");
    return firstText.isEmpty()
        && icons.stream().anyMatch(img -> img.attr("alt").contains("공지"));
  }
}
