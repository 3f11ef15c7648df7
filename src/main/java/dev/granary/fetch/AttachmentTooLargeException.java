package dev.granary.fetch;

/** An attachment download was aborted because it exceeded the storage size ceiling. */
public class AttachmentTooLargeException extends RuntimeException {

  private final long limitBytes;

  public AttachmentTooLargeException(String url, long limitBytes) {
    super("Attachment larger than " + limitBytes + " bytes: " + url);
    this.limitBytes = limitBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }
}
