package dev.granary.storage;

/**
 * Object storage for attachment bytes. Paths are storage-relative and stable; download URLs are
 * short-lived and signed.
 */
public interface AttachmentStorage {

  /**
   * Stores a file. Failures are reported in the result, not thrown.
   *
   * @param upload bytes plus naming information
   * @return the storage path and URL on success
   */
  StoredFile upload(StorageUpload upload);

  /**
   * Creates a time-limited download URL.
   *
   * @param path storage path returned by {@link #upload}
   * @param ttlSeconds validity in seconds
   * @return an absolute or server-relative signed URL
   */
  String signedUrl(String path, long ttlSeconds);

  /**
   * Reads stored bytes back.
   *
   * @throws StorageException when the file is missing or unreadable
   */
  byte[] read(String path);

  void delete(String path);
}
