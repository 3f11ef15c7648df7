package dev.granary.storage;

import dev.granary.catalog.Attachment;
import org.springframework.stereotype.Component;

/** Chooses the URL a client should use to download an attachment. */
@Component
public class AttachmentLinks {

  private final AttachmentStorage storage;
  private final long ttlSeconds;

  public AttachmentLinks(AttachmentStorage storage, StorageProperties properties) {
    this.storage = storage;
    this.ttlSeconds = properties.signedUrlTtlSeconds();
  }

  /**
   * A signed storage URL when the attachment's bytes were stored, otherwise its original remote
   * URL.
   */
  public String downloadUrl(Attachment attachment) {
    if (attachment.isStored()) {
      return storage.signedUrl(attachment.getStoragePath(), ttlSeconds);
    }
    return attachment.getSourceUrl();
  }
}
