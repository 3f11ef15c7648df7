package dev.granary.detail;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Attachment handling settings bound from {@code granary.attachments.*}.
 *
 * @param maxStoredBytes size ceiling for attachments that are downloaded and stored
 */
@ConfigurationProperties(prefix = "granary.attachments")
public record AttachmentProperties(long maxStoredBytes) {

  public static final long DEFAULT_MAX_STORED_BYTES = 50L * 1024 * 1024;

  public AttachmentProperties {
    if (maxStoredBytes <= 0) {
      maxStoredBytes = DEFAULT_MAX_STORED_BYTES;
    }
  }
}
