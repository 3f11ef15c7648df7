package dev.granary.fetch;

import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.RequestOptions;
import com.microsoft.playwright.options.WaitUntilState;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * Process-wide headless Chromium shared by every browser-rendered fetch.
 *
 * <p>The browser is launched lazily by the first {@link #acquire()} and stays up until {@link
 * #release()} is called at the end of a crawl batch; the next {@code acquire()} relaunches it. Each
 * fetch opens its own page and closes it afterwards.
 *
 * <p>Playwright objects are not thread-safe, so every Playwright call runs on one dedicated
 * {@code shared-browser} thread. Callers block on that thread's result; the lease semaphore bounds
 * how many callers can queue work on it at once.
 */
@Component
public class SharedBrowser implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(SharedBrowser.class);

  static final List<String> LAUNCH_ARGS =
      List.of(
          "--no-sandbox", "--disable-setuid-sandbox", "--disable-dev-shm-usage", "--disable-gpu");

  /** A 4xx/5xx page is still usable when it carries a table or at least this much markup. */
  static final int USABLE_ERROR_PAGE_LENGTH = 10_000;

  /** Short pages mentioning "error" are block/error stubs rather than listings. */
  static final int ERROR_STUB_MAX_LENGTH = 5_000;

  private static final long LAUNCH_TIMEOUT_SECONDS = 60;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
  private static final long RESULT_GRACE_MS = 15_000;

  private final FetchProperties properties;
  private final Semaphore leases;
  private final Object lifecycleLock = new Object();

  private @Nullable ExecutorService browserThread;

  // Confined to the shared-browser thread.
  private @Nullable Playwright playwright;
  private @Nullable Browser browser;
  private @Nullable BrowserContext context;

  public SharedBrowser(FetchProperties properties) {
    this.properties = properties;
    this.leases = new Semaphore(Math.max(1, properties.browserConcurrency()), true);
  }

  /**
   * Takes a lease on the shared browser, launching it if needed. Blocks while the concurrency cap
   * is reached. The lease must be closed, typically with try-with-resources.
   *
   * @return a lease for rendering pages and downloading files
   * @throws FetchException if the browser cannot be launched or the wait is interrupted
   */
  public BrowserLease acquire() {
    try {
      leases.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(
          FetchException.Kind.TRANSIENT, "", "Interrupted while waiting for the browser", e);
    }
    try {
      ensureStarted();
    } catch (RuntimeException e) {
      leases.release();
      throw e;
    }
    return new BrowserLease(this);
  }

  /** Shuts the browser process down. Safe to call when it was never started. */
  public void release() {
    synchronized (lifecycleLock) {
      ExecutorService thread = browserThread;
      if (thread == null) {
        return;
      }
      try {
        thread.submit(this::closeOnBrowserThread).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("Shared browser closed");
      } catch (ExecutionException | TimeoutException e) {
        log.warn("Shared browser did not shut down cleanly: {}", e.getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while closing the shared browser");
      } finally {
        thread.shutdownNow();
        browserThread = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return browserThread != null;
    }
  }

  @Override
  public void destroy() {
    release();
  }

  FetchedPage render(String url, FetchOptions options) {
    long timeoutMs = navigationTimeoutMs(options);
    long budget = timeoutMs + properties.selectorTimeoutMs() + properties.settleDelayMs();
    return onBrowserThread(url, budget, () -> renderPage(url, options, timeoutMs));
  }

  byte[] download(String url, @Nullable String referer, long maxBytes) {
    long timeoutMs = properties.navigationTimeoutMs();
    return onBrowserThread(url, timeoutMs, () -> requestBytes(url, referer, maxBytes, timeoutMs));
  }

  void returnLease() {
    leases.release();
  }

  /**
   * Rejects error responses that carry no listing content.
   *
   * @throws FetchException when the status is 4xx/5xx without a table or substantial markup, or
   *     when the page is a short error stub
   */
  static void checkRendered(String url, int status, String html) {
    String markup = html == null ? "" : html;
    if (status >= 400) {
      boolean usable = markup.contains("<table") || markup.length() > USABLE_ERROR_PAGE_LENGTH;
      if (!usable) {
        throw FetchException.forStatus(url, status);
      }
      log.debug("HTTP {} for {} but page has content, continuing", status, url);
    }
    if (markup.length() < ERROR_STUB_MAX_LENGTH
        && markup.toLowerCase(Locale.ROOT).contains("error")) {
      throw new FetchException(FetchException.Kind.BLOCKED, url, "Error page served for " + url);
    }
  }

  private long navigationTimeoutMs(FetchOptions options) {
    return options.timeout() != null
        ? options.timeout().toMillis()
        : properties.navigationTimeoutMs();
  }

  private <T> T onBrowserThread(String url, long budgetMs, Callable<T> task) {
    ExecutorService thread;
    synchronized (lifecycleLock) {
      thread = browserThread;
    }
    if (thread == null) {
      throw new FetchException(
          FetchException.Kind.TRANSIENT, url, "Shared browser was released during the fetch");
    }
    // Queued work from other lease holders counts against the wait.
    long waitMs = (budgetMs + RESULT_GRACE_MS) * Math.max(1, properties.browserConcurrency());
    Future<T> future = thread.submit(task);
    try {
      return future.get(waitMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new FetchException(
          FetchException.Kind.TIMEOUT, url, "Browser fetch timed out: " + url, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new FetchException(
          FetchException.Kind.TRANSIENT, url, "Interrupted fetching " + url, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new FetchException(FetchException.Kind.TRANSIENT, url, String.valueOf(cause), cause);
    }
  }

  private FetchedPage renderPage(String url, FetchOptions options, long timeoutMs) {
    Page page = requireContext().newPage();
    try {
      Response response =
          page.navigate(
              url,
              new Page.NavigateOptions()
                  .setTimeout(timeoutMs)
                  .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
      if (properties.settleDelayMs() > 0) {
        page.waitForTimeout(properties.settleDelayMs());
      }
      if (options.waitSelector() != null) {
        try {
          page.waitForSelector(
              options.waitSelector(),
              new Page.WaitForSelectorOptions().setTimeout(properties.selectorTimeoutMs()));
        } catch (TimeoutError e) {
          log.debug("Selector '{}' not found on {}, continuing", options.waitSelector(), url);
        }
      }
      String html = page.content();
      checkRendered(url, response != null ? response.status() : 200, html);
      return new FetchedPage(html, page.url());
    } catch (TimeoutError e) {
      throw new FetchException(FetchException.Kind.TIMEOUT, url, "Navigation timed out: " + url, e);
    } catch (PlaywrightException e) {
      throw new FetchException(
          FetchException.Kind.TRANSIENT, url, "Browser error on " + url + ": " + e.getMessage(), e);
    } finally {
      closePage(page, url);
    }
  }

  private byte[] requestBytes(String url, @Nullable String referer, long maxBytes, long timeoutMs) {
    RequestOptions request = RequestOptions.create().setTimeout(timeoutMs);
    if (referer != null) {
      request.setHeader("Referer", referer);
    }
    APIResponse response;
    try {
      response = requireContext().request().get(url, request);
    } catch (TimeoutError e) {
      throw new FetchException(FetchException.Kind.TIMEOUT, url, "Download timed out: " + url, e);
    } catch (PlaywrightException e) {
      throw new FetchException(FetchException.Kind.TRANSIENT, url, e.getMessage(), e);
    }
    try {
      if (!response.ok()) {
        throw FetchException.forStatus(url, response.status());
      }
      String declared = response.headers().get("content-length");
      if (declared != null && parseLength(declared) > maxBytes) {
        throw new AttachmentTooLargeException(url, maxBytes);
      }
      byte[] body = response.body();
      if (body.length > maxBytes) {
        throw new AttachmentTooLargeException(url, maxBytes);
      }
      return body;
    } finally {
      response.dispose();
    }
  }

  private static long parseLength(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private BrowserContext requireContext() {
    if (context == null) {
      throw new FetchException(FetchException.Kind.TRANSIENT, "", "Shared browser is not running");
    }
    return context;
  }

  private void ensureStarted() {
    synchronized (lifecycleLock) {
      if (browserThread != null) {
        return;
      }
      ExecutorService thread =
          Executors.newSingleThreadExecutor(
              runnable -> {
                Thread t = new Thread(runnable, "shared-browser");
                t.setDaemon(true);
                return t;
              });
      try {
        thread.submit(this::launchOnBrowserThread).get(LAUNCH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (ExecutionException | TimeoutException e) {
        thread.shutdownNow();
        throw new FetchException(
            FetchException.Kind.TRANSIENT, "", "Failed to launch browser: " + e.getMessage(), e);
      } catch (InterruptedException e) {
        thread.shutdownNow();
        Thread.currentThread().interrupt();
        throw new FetchException(
            FetchException.Kind.TRANSIENT, "", "Interrupted while launching browser", e);
      }
      browserThread = thread;
      log.info("Shared browser launched (headless={})", properties.headless());
    }
  }

  private Void launchOnBrowserThread() {
    try {
      playwright = Playwright.create();
      browser =
          playwright
              .chromium()
              .launch(
                  new BrowserType.LaunchOptions()
                      .setHeadless(properties.headless())
                      .setArgs(LAUNCH_ARGS));
      context =
          browser.newContext(
              new Browser.NewContextOptions()
                  .setUserAgent(properties.userAgent())
                  .setViewportSize(1920, 1080)
                  .setLocale("ko-KR")
                  .setTimezoneId("Asia/Seoul")
                  .setExtraHTTPHeaders(
                      Map.of("Accept-Language", "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7")));
      return null;
    } catch (RuntimeException e) {
      closeOnBrowserThread();
      throw e;
    }
  }

  private Void closeOnBrowserThread() {
    if (context != null) {
      try {
        context.close();
      } catch (PlaywrightException e) {
        log.warn("Failed to close browser context: {}", e.getMessage());
      }
      context = null;
    }
    if (browser != null) {
      try {
        browser.close();
      } catch (PlaywrightException e) {
        log.warn("Failed to close browser: {}", e.getMessage());
      }
      browser = null;
    }
    if (playwright != null) {
      try {
        playwright.close();
      } catch (PlaywrightException e) {
        log.warn("Failed to close Playwright driver: {}", e.getMessage());
      }
      playwright = null;
    }
    return null;
  }

  private static void closePage(Page page, String url) {
    try {
      page.close();
    } catch (PlaywrightException e) {
      log.debug("Failed to close page for {}: {}", url, e.getMessage());
    }
  }
}
