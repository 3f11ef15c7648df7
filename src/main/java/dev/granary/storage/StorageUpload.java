package dev.granary.storage;

import java.util.Objects;

/**
 * A file to store.
 *
 * @param announcementKey groups files of one announcement under a common prefix
 * @param fileName original file name, used for the extension only
 * @param bytes content
 * @param mimeType MIME type
 */
public record StorageUpload(
    String announcementKey, String fileName, byte[] bytes, String mimeType) {

  public StorageUpload {
    Objects.requireNonNull(announcementKey, "announcementKey must not be null");
    Objects.requireNonNull(fileName, "fileName must not be null");
    Objects.requireNonNull(bytes, "bytes must not be null");
  }
}
