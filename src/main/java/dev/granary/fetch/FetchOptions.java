package dev.granary.fetch;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Per-call fetch options.
 *
 * @param waitSelector CSS selector the browser path waits for before capturing HTML; null skips
 *     the wait
 * @param forceBrowser render through the shared browser even when the host is not WAF-protected
 * @param timeout navigation timeout; null uses {@code granary.fetch.navigation-timeout-ms}
 */
public record FetchOptions(
    @Nullable String waitSelector, boolean forceBrowser, @Nullable Duration timeout) {

  private static final FetchOptions DEFAULTS = new FetchOptions(null, false, null);

  public FetchOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (waitSelector != null && waitSelector.isBlank()) {
      waitSelector = null;
    }
  }

  /** Plain fetch unless the host is WAF-protected. */
  public static FetchOptions defaults() {
    return DEFAULTS;
  }

  /** Browser-rendered fetch that optionally waits for {@code waitSelector}. */
  public static FetchOptions browser(@Nullable String waitSelector) {
    return new FetchOptions(waitSelector, true, null);
  }
}
