package dev.granary.detail;

import dev.granary.fetch.FetchException;

/** The detail page of a listing item could not be fetched. */
public class DetailFetchException extends RuntimeException {

  private final String url;

  public DetailFetchException(String url, FetchException cause) {
    super("Detail page unavailable (" + cause.getKind() + "): " + url, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }

  public FetchException.Kind getKind() {
    return ((FetchException) getCause()).getKind();
  }
}
