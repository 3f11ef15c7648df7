package dev.granary.catalog;

import java.util.List;
import java.util.UUID;

/**
 * Published when an announcement is soft-deleted.
 *
 * @param announcementId the deleted announcement
 * @param attachmentIds its attachments, whose search chunks go with it
 */
public record AnnouncementRemovedEvent(UUID announcementId, List<UUID> attachmentIds) {}
