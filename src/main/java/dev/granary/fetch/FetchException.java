package dev.granary.fetch;

/**
 * A single fetch attempt failed. The fetch layer never retries; callers decide what to do with
 * each {@link Kind}.
 */
public class FetchException extends RuntimeException {

  /** Failure classification. */
  public enum Kind {
    /** Network error or a 5xx/unexpected response that may succeed later. */
    TRANSIENT,
    /** The origin refused the request (403, 429 or a bot-mitigation page). */
    BLOCKED,
    /** Connect, read or navigation timeout. */
    TIMEOUT
  }

  private final Kind kind;
  private final String url;

  public FetchException(Kind kind, String url, String message) {
    super(message);
    this.kind = kind;
    this.url = url;
  }

  public FetchException(Kind kind, String url, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.url = url;
  }

  /**
   * Maps a non-2xx HTTP status to a failure.
   *
   * @param url the requested URL
   * @param status the response status code
   * @return {@link Kind#BLOCKED} for 401, 403 and 429, otherwise {@link Kind#TRANSIENT}
   */
  public static FetchException forStatus(String url, int status) {
    Kind kind = status == 401 || status == 403 || status == 429 ? Kind.BLOCKED : Kind.TRANSIENT;
    return new FetchException(kind, url, "HTTP " + status + " for " + url);
  }

  public Kind getKind() {
    return kind;
  }

  public String getUrl() {
    return url;
  }
}
