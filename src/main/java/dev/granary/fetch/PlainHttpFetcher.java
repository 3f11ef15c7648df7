package dev.granary.fetch;

import java.io.ByteArrayInputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Single-attempt HTTP GET for portals that serve their listings as static HTML.
 *
 * <p>The body is decoded with the charset from {@code Content-Type} when present, otherwise jsoup
 * detects it from the markup (many portals still serve EUC-KR).
 */
@Component
public class PlainHttpFetcher {

  private final RestClient restClient;

  public PlainHttpFetcher(@Qualifier("fetchRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  /**
   * Fetches a page.
   *
   * @param url absolute URL
   * @return the decoded page
   * @throws FetchException on a non-2xx status, timeout or I/O failure
   */
  public FetchedPage fetch(String url) {
    try {
      return restClient
          .get()
          .uri(toUri(url))
          .exchange(
              (request, response) -> {
                if (!response.getStatusCode().is2xxSuccessful()) {
                  throw FetchException.forStatus(url, response.getStatusCode().value());
                }
                byte[] body = response.getBody().readAllBytes();
                MediaType contentType = response.getHeaders().getContentType();
                String charset =
                    contentType != null && contentType.getCharset() != null
                        ? contentType.getCharset().name()
                        : null;
                Document document = Jsoup.parse(new ByteArrayInputStream(body), charset, url);
                return new FetchedPage(document.outerHtml(), url);
              });
    } catch (ResourceAccessException e) {
      throw classify(url, e);
    }
  }

  static FetchException classify(String url, ResourceAccessException e) {
    Throwable cause = e.getCause();
    if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
      return new FetchException(FetchException.Kind.TIMEOUT, url, "Timed out fetching " + url, e);
    }
    return new FetchException(
        FetchException.Kind.TRANSIENT, url, "I/O error fetching " + url + ": " + e.getMessage(), e);
  }

  /**
   * Builds a {@link URI} without re-encoding: portal links are frequently already percent-encoded
   * and {@code RestClient}'s template expansion would encode them twice.
   */
  static URI toUri(String url) {
    return URI.create(url.trim().replace(" ", "%20"));
  }
}
