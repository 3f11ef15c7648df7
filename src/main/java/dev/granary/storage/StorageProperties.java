package dev.granary.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Attachment storage settings bound from {@code granary.storage.*}.
 *
 * @param root directory files are written under
 * @param signingSecret HMAC key for download URLs
 * @param publicBaseUrl prefix of download URLs, empty for server-relative URLs
 * @param signedUrlTtlSeconds default validity of download URLs
 */
@ConfigurationProperties(prefix = "granary.storage")
public record StorageProperties(
    String root, String signingSecret, String publicBaseUrl, long signedUrlTtlSeconds) {

  public StorageProperties {
    if (root == null || root.isBlank()) {
      throw new IllegalArgumentException("granary.storage.root must be set");
    }
    if (signingSecret == null || signingSecret.isBlank()) {
      throw new IllegalArgumentException("granary.storage.signing-secret must be set");
    }
    if (publicBaseUrl == null) {
      publicBaseUrl = "";
    }
    if (signedUrlTtlSeconds <= 0) {
      signedUrlTtlSeconds = 300;
    }
  }
}
