package dev.granary.catalog;

/** Publication state of an {@link Announcement}. */
public enum AnnouncementStatus {
  /** Open for applications, or permanent. */
  ACTIVE,
  /** Deadline has passed. */
  CLOSED,
  /** Not yet published to the catalog. */
  DRAFT
}
