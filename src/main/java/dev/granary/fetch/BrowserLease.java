package dev.granary.fetch;

import org.jspecify.annotations.Nullable;

/**
 * A caller's hold on the {@link SharedBrowser}. Closing the lease frees a concurrency slot; the
 * browser process itself keeps running.
 */
public final class BrowserLease implements AutoCloseable {

  private final SharedBrowser browser;
  private boolean closed;

  BrowserLease(SharedBrowser browser) {
    this.browser = browser;
  }

  /**
   * Renders a page in a fresh tab.
   *
   * @param url absolute URL
   * @param options selector wait and timeout
   * @return the rendered HTML and the final URL after redirects
   */
  public FetchedPage render(String url, FetchOptions options) {
    ensureOpen();
    return browser.render(url, options);
  }

  /**
   * Downloads a file with the browser's cookies and fingerprint.
   *
   * @param url file URL
   * @param referer detail page URL, sent as {@code Referer}; may be null
   * @param maxBytes size ceiling
   * @return the file bytes
   */
  public byte[] download(String url, @Nullable String referer, long maxBytes) {
    ensureOpen();
    return browser.download(url, referer, maxBytes);
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      browser.returnLease();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Browser lease already closed");
    }
  }
}
