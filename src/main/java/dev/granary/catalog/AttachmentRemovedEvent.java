package dev.granary.catalog;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Published when an attachment row is deleted, so its search chunks and stored file can follow.
 *
 * @param attachmentId the deleted attachment
 * @param announcementId its announcement
 * @param storagePath stored file, or null when only the remote URL was kept
 */
public record AttachmentRemovedEvent(
    UUID attachmentId, UUID announcementId, @Nullable String storagePath) {}
