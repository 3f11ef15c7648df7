package dev.granary.analysis;

import java.util.UUID;

/** An attachment could not be analyzed. The failure is recorded on the attachment. */
public class AnalysisException extends RuntimeException {

  private final UUID attachmentId;

  public AnalysisException(UUID attachmentId, String message) {
    super(message);
    this.attachmentId = attachmentId;
  }

  public AnalysisException(UUID attachmentId, String message, Throwable cause) {
    super(message, cause);
    this.attachmentId = attachmentId;
  }

  public UUID getAttachmentId() {
    return attachmentId;
  }
}
