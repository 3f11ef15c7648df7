package dev.granary.fetch;

import java.io.InputStream;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Downloads attachment bytes, enforcing the storage size ceiling while streaming so oversized files
 * are abandoned early. WAF-protected hosts are downloaded through the shared browser context.
 */
@Component
public class AttachmentDownloader {

  private final RestClient restClient;
  private final SharedBrowser sharedBrowser;

  public AttachmentDownloader(
      @Qualifier("fetchRestClient") RestClient restClient, SharedBrowser sharedBrowser) {
    this.restClient = restClient;
    this.sharedBrowser = sharedBrowser;
  }

  /**
   * Downloads a file.
   *
   * @param url file URL
   * @param referer page that linked the file; many portals reject downloads without it
   * @param viaBrowser use the shared browser context instead of plain HTTP
   * @param maxBytes size ceiling in bytes
   * @return the file content
   * @throws AttachmentTooLargeException when the file exceeds {@code maxBytes}
   * @throws FetchException when the download fails
   */
  public byte[] download(String url, @Nullable String referer, boolean viaBrowser, long maxBytes) {
    if (viaBrowser || WafDomains.isWafBlockedDomain(url)) {
      try (BrowserLease lease = sharedBrowser.acquire()) {
        return lease.download(url, referer, maxBytes);
      }
    }
    try {
      return restClient
          .get()
          .uri(PlainHttpFetcher.toUri(url))
          .headers(
              headers -> {
                if (referer != null) {
                  headers.set(HttpHeaders.REFERER, referer);
                }
              })
          .exchange(
              (request, response) -> {
                if (!response.getStatusCode().is2xxSuccessful()) {
                  throw FetchException.forStatus(url, response.getStatusCode().value());
                }
                long declared = response.getHeaders().getContentLength();
                if (declared > maxBytes) {
                  throw new AttachmentTooLargeException(url, maxBytes);
                }
                try (InputStream body = response.getBody()) {
                  int limit = (int) Math.min(maxBytes + 1, Integer.MAX_VALUE - 8L);
                  byte[] content = body.readNBytes(limit);
                  if (content.length > maxBytes) {
                    throw new AttachmentTooLargeException(url, maxBytes);
                  }
                  return content;
                }
              });
    } catch (ResourceAccessException e) {
      throw PlainHttpFetcher.classify(url, e);
    }
  }
}
