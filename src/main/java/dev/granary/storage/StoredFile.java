package dev.granary.storage;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link AttachmentStorage#upload}.
 *
 * @param success whether the bytes were written
 * @param filePath storage path on success
 * @param fileUrl signed download URL on success
 * @param error failure description otherwise
 */
public record StoredFile(
    boolean success, @Nullable String filePath, @Nullable String fileUrl, @Nullable String error) {

  public static StoredFile stored(String filePath, String fileUrl) {
    return new StoredFile(true, filePath, fileUrl, null);
  }

  public static StoredFile failed(String error) {
    return new StoredFile(false, null, null, error);
  }
}
