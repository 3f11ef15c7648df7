package dev.granary.catalog;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An attachment observed on a detail page, with its storage and analysis results.
 *
 * @param fileName display file name
 * @param sourceUrl absolute download URL on the origin
 * @param type file type
 * @param mimeType MIME type
 * @param role guessed purpose
 * @param sizeBytes size when known
 * @param shouldParse selective-storage decision
 * @param storagePath storage path when the bytes were stored; null for remote-only attachments
 * @param analysis analysis result; null when no analysis was attempted
 */
public record AttachmentDraft(
    String fileName,
    String sourceUrl,
    AttachmentType type,
    String mimeType,
    AttachmentRole role,
    @Nullable Long sizeBytes,
    boolean shouldParse,
    @Nullable String storagePath,
    @Nullable AttachmentAnalysis analysis) {

  public AttachmentDraft {
    Objects.requireNonNull(fileName, "fileName must not be null");
    Objects.requireNonNull(sourceUrl, "sourceUrl must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(role, "role must not be null");
  }

  /** Copy recording a completed analysis. */
  public AttachmentDraft withAnalysis(AttachmentAnalysis outcome) {
    return new AttachmentDraft(
        fileName, sourceUrl, type, mimeType, role, sizeBytes, shouldParse, storagePath, outcome);
  }
}
