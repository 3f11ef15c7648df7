package dev.granary.fetch;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Static table of portals behind bot-mitigation layers that reject plain HTTP clients. Pages on
 * these hosts are always rendered through the shared browser.
 */
public final class WafDomains {

  static final Set<String> DOMAINS =
      Set.of(
          "gdtp.or.kr",
          "gntp.or.kr",
          "gbtp.or.kr",
          "gjtp.or.kr",
          "dgtp.or.kr",
          "djtp.or.kr",
          "sjtp.or.kr",
          "utp.or.kr",
          "jntp.or.kr",
          "jejutp.or.kr",
          "ptp.or.kr",
          "ctp.or.kr");

  private WafDomains() {
    // utility class
  }

  /**
   * Checks whether the URL's host is a WAF-protected domain or one of its subdomains. Path, query
   * and port are ignored.
   *
   * @param url absolute URL
   * @return true for a protected host, false otherwise (including malformed URLs)
   */
  public static boolean isWafBlockedDomain(String url) {
    String host = hostOf(url);
    if (host == null) {
      return false;
    }
    for (String domain : DOMAINS) {
      if (host.equals(domain) || host.endsWith("." + domain)) {
        return true;
      }
    }
    return false;
  }

  private static String hostOf(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      String host = URI.create(url.trim().replace(" ", "%20")).getHost();
      return host == null ? null : host.toLowerCase(Locale.ROOT);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
