package dev.granary.catalog;

/** Review state of a {@link ProjectGroup}. */
public enum GroupReviewStatus {
  /** Grouped by fingerprint, members agree. */
  AUTO_GROUPED,
  /** Members disagree on category or amount; a person should check the merge. */
  PENDING_REVIEW,
  /** Checked and confirmed by an operator. */
  CONFIRMED
}
