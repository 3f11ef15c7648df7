package dev.granary.listing;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;

/**
 * Page-level information the strategies need to turn anchors into detail links.
 *
 * @param pageUrl URL the listing was served from, used as the base for relative links
 * @param detailUrlTemplate template for boards that open posts through script handlers such as
 *     {@code fn_view('1234')}; {@code {id}} is replaced by the handler's first argument
 */
public record ListingContext(String pageUrl, @Nullable String detailUrlTemplate) {

  private static final Pattern HANDLER_ARGUMENT =
      Pattern.compile("\\(\\s*['\"]?([\\w.\\-]+)['\"]?\\s*[,)]");

  public ListingContext {
    pageUrl = pageUrl == null ? "" : pageUrl;
  }

  public static ListingContext of(String pageUrl) {
    return new ListingContext(pageUrl, null);
  }

  /**
   * Resolves an anchor to an absolute detail URL.
   *
   * @param anchor the {@code a} element
   * @return the absolute URL, or null when the anchor has no usable target
   */
  public @Nullable String resolveLink(Element anchor) {
    String href = anchor.attr("href").trim();
    String lower = href.toLowerCase(Locale.ROOT);
    if (href.isEmpty() || href.startsWith("#") || lower.startsWith("javascript:")) {
      boolean scriptHref = lower.startsWith("javascript:") && !lower.contains("void");
      return resolveHandler(scriptHref ? href : anchor.attr("onclick"));
    }
    String absolute = anchor.absUrl("href");
    if (!absolute.isEmpty()) {
      return absolute;
    }
    return href.startsWith("http://") || href.startsWith("https://") ? href : null;
  }

  private @Nullable String resolveHandler(String script) {
    if (detailUrlTemplate == null || script == null || script.isBlank()) {
      return null;
    }
    Matcher matcher = HANDLER_ARGUMENT.matcher(script);
    if (!matcher.find()) {
      return null;
    }
    return detailUrlTemplate.replace("{id}", matcher.group(1));
  }
}
