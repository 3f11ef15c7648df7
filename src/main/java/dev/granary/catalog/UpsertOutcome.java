package dev.granary.catalog;

import java.util.UUID;

/**
 * Result of {@link CatalogService#upsert}.
 *
 * @param announcementId id of the created or updated announcement
 * @param created true when a new row was inserted
 * @param attachmentsRecorded attachments inserted or refreshed
 * @param duplicatesRemoved duplicate attachment rows collapsed
 */
public record UpsertOutcome(
    UUID announcementId, boolean created, int attachmentsRecorded, int duplicatesRemoved) {}
