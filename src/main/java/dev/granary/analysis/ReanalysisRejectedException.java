package dev.granary.analysis;

import java.util.UUID;

/** A reanalysis request conflicts with the attachment's current analysis state. */
public class ReanalysisRejectedException extends IllegalStateException {

  private final UUID attachmentId;

  public ReanalysisRejectedException(UUID attachmentId, String message) {
    super(message);
    this.attachmentId = attachmentId;
  }

  public UUID getAttachmentId() {
    return attachmentId;
  }
}
