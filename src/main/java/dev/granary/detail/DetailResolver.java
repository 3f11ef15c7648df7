package dev.granary.detail;

import dev.granary.catalog.AttachmentRole;
import dev.granary.catalog.AttachmentType;
import dev.granary.fetch.FetchAdapter;
import dev.granary.fetch.FetchException;
import dev.granary.fetch.FetchOptions;
import dev.granary.fetch.FetchedPage;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches an announcement detail page and extracts its main text and attachment links.
 *
 * <p>Only the page fetch can fail ({@link DetailFetchException}); extraction is best-effort and
 * yields empty text or no attachments for layouts it does not recognize.
 */
@Component
public class DetailResolver {

  private static final Logger log = LoggerFactory.getLogger(DetailResolver.class);

  static final List<String> CONTENT_SELECTORS =
      List.of(".view", ".board_view", ".bbs_view", ".view_cont", "article", "#content", ".content");

  static final String ATTACHMENT_SELECTOR =
      "a[href*=.hwp], a[href*=.hwpx], a[href*=.pdf], a[href*=download], a[href*=file],"
          + " a[href*=attach], .file a, .attachment a, .download a";

  private static final String CHROME = "script, style, noscript, nav, header, footer";

  private static final Pattern SIZE_HINT =
      Pattern.compile(
          "[(\\[]?\\s*(\\d+(?:[.,]\\d+)?)\\s*(bytes?|[kmg]b|b)\\s*[)\\]]?\\s*$",
          Pattern.CASE_INSENSITIVE);

  private static final Set<String> GENERIC_LINK_TEXT =
      Set.of("다운로드", "download", "바로보기", "미리보기", "내려받기", "첨부파일", "파일", "보기");

  private final FetchAdapter fetchAdapter;
  private final SelectiveStoragePolicy storagePolicy;

  public DetailResolver(FetchAdapter fetchAdapter, SelectiveStoragePolicy storagePolicy) {
    this.fetchAdapter = fetchAdapter;
    this.storagePolicy = storagePolicy;
  }

  /**
   * Fetches and parses a detail page.
   *
   * @param link absolute detail URL
   * @param options fetch options of the owning source
   * @return extracted text and attachments
   * @throws DetailFetchException when the page cannot be fetched
   */
  public DetailPage resolveDetail(String link, FetchOptions options) {
    FetchedPage page;
    try {
      page = fetchAdapter.fetch(link, options);
    } catch (FetchException e) {
      throw new DetailFetchException(link, e);
    }
    return parse(page.html(), page.finalUrl());
  }

  DetailPage parse(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    String fullText = extractText(doc);
    List<AttachmentLink> attachments = extractAttachments(doc);
    log.debug(
        "Detail {}: {} chars, {} attachments", pageUrl, fullText.length(), attachments.size());
    return new DetailPage(fullText, attachments, pageUrl);
  }

  static String extractText(Document doc) {
    Element container = null;
    for (String selector : CONTENT_SELECTORS) {
      Element candidate = doc.selectFirst(selector);
      if (candidate != null && !candidate.text().isBlank()) {
        container = candidate;
        break;
      }
    }
    if (container == null) {
      container = doc.body();
    }
    Element copy = container.clone();
    copy.select(CHROME).remove();
    return copy.text().replace('\u00a0', ' ').replaceAll("\\s+", " ").strip();
  }

  private List<AttachmentLink> extractAttachments(Document doc) {
    Map<String, AttachmentLink> byUrl = new LinkedHashMap<>();
    for (Element anchor : doc.select(ATTACHMENT_SELECTOR)) {
      String url = anchor.absUrl("href");
      if (!url.startsWith("http://") && !url.startsWith("https://")) {
        continue;
      }
      if (byUrl.containsKey(url)) {
        continue;
      }
      byUrl.put(url, toLink(anchor, url));
    }
    return new ArrayList<>(byUrl.values());
  }

  private AttachmentLink toLink(Element anchor, String url) {
    String text = anchor.text().replace('\u00a0', ' ').strip();
    Long size = parseSize(text);
    String fileName = fileName(anchor, text, url);
    AttachmentType type = AttachmentClassifier.typeOf(fileName, url);
    AttachmentRole role = AttachmentClassifier.roleOf(fileName);
    boolean shouldParse = storagePolicy.shouldParse(fileName, type, size);
    return new AttachmentLink(fileName, url, type, type.mimeType(), role, size, shouldParse);
  }

  static String fileName(Element anchor, String linkText, String url) {
    String fromText = stripSizeHint(linkText);
    if (!fromText.isEmpty() && !GENERIC_LINK_TEXT.contains(fromText.toLowerCase(Locale.ROOT))) {
      return fromText;
    }
    String download = anchor.attr("download").strip();
    if (!download.isEmpty()) {
      return download;
    }
    String segment = lastPathSegment(url);
    return segment != null ? segment : "attachment";
  }

  static String stripSizeHint(String text) {
    return SIZE_HINT.matcher(text).replaceFirst("").strip();
  }

  /**
   * Parses a trailing size hint such as {@code (1.2MB)} or {@code [350 KB]}.
   *
   * @return size in bytes, or null when the text has no hint
   */
  static @Nullable Long parseSize(String text) {
    Matcher m = SIZE_HINT.matcher(text);
    if (!m.find()) {
      return null;
    }
    double value = Double.parseDouble(m.group(1).replace(',', '.'));
    long multiplier =
        switch (m.group(2).toLowerCase(Locale.ROOT)) {
          case "kb" -> 1024L;
          case "mb" -> 1024L * 1024;
          case "gb" -> 1024L * 1024 * 1024;
          default -> 1L;
        };
    return Math.round(value * multiplier);
  }

  private static @Nullable String lastPathSegment(String url) {
    String path;
    try {
      path = URI.create(url.replace(" ", "%20")).getRawPath();
    } catch (IllegalArgumentException e) {
      log.debug("Unparseable attachment URL {}: {}", url, e.getMessage());
      return null;
    }
    if (path == null || path.isEmpty() || path.endsWith("/")) {
      return null;
    }
    String segment = path.substring(path.lastIndexOf('/') + 1);
    return segment.isEmpty() ? null : URLDecoder.decode(segment, StandardCharsets.UTF_8);
  }
}
