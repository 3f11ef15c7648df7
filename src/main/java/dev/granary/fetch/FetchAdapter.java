package dev.granary.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves a URL to HTML, choosing between a plain HTTP GET and a page rendered by the {@link
 * SharedBrowser}. WAF-protected hosts and callers that ask for a browser get the rendered path.
 *
 * <p>Single attempt: failures surface as {@link FetchException} and retry decisions are left to
 * the caller.
 */
@Service
public class FetchAdapter {

  private static final Logger log = LoggerFactory.getLogger(FetchAdapter.class);

  private final PlainHttpFetcher plainHttpFetcher;
  private final SharedBrowser sharedBrowser;

  public FetchAdapter(PlainHttpFetcher plainHttpFetcher, SharedBrowser sharedBrowser) {
    this.plainHttpFetcher = plainHttpFetcher;
    this.sharedBrowser = sharedBrowser;
  }

  /**
   * Fetches a page.
   *
   * @param url absolute URL
   * @param options browser and selector options
   * @return the page HTML and final URL
   * @throws FetchException when the fetch fails or times out
   */
  public FetchedPage fetch(String url, FetchOptions options) {
    if (usesBrowser(url, options)) {
      log.debug("Fetching {} through the shared browser", url);
      try (BrowserLease lease = sharedBrowser.acquire()) {
        return lease.render(url, options);
      }
    }
    log.debug("Fetching {} over plain HTTP", url);
    return plainHttpFetcher.fetch(url);
  }

  /**
   * Whether {@link #fetch} would route the URL through the browser.
   *
   * @param url absolute URL
   * @param options fetch options
   * @return true for WAF-protected hosts or when the options force the browser
   */
  public boolean usesBrowser(String url, FetchOptions options) {
    return options.forceBrowser() || WafDomains.isWafBlockedDomain(url);
  }
}
