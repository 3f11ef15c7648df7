package dev.granary.dedup;

import dev.granary.catalog.Announcement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.UUID;

/**
 * Picks the representative of a group: latest deadline (no deadline ranks last), then most
 * recently created, then greatest id. The order is total, so the choice is deterministic.
 */
public final class CanonicalSelector {

  private static final Comparator<LocalDate> LATER_DATE = Comparator.naturalOrder();
  private static final Comparator<Instant> LATER_INSTANT = Comparator.naturalOrder();
  private static final Comparator<UUID> GREATER_ID = Comparator.naturalOrder();

  /** Ascending preference; the maximum is canonical. */
  static final Comparator<Announcement> PREFERENCE =
      Comparator.comparing(Announcement::getDeadline, Comparator.nullsFirst(LATER_DATE))
          .thenComparing(Announcement::getCreatedAt, Comparator.nullsFirst(LATER_INSTANT))
          .thenComparing(Announcement::getId, Comparator.nullsFirst(GREATER_ID));

  private CanonicalSelector() {
    // utility class
  }

  /**
   * @param members non-empty group members
   * @return the canonical member
   * @throws IllegalArgumentException when {@code members} is empty
   */
  public static Announcement select(Collection<Announcement> members) {
    return members.stream()
        .max(PREFERENCE)
        .orElseThrow(() -> new IllegalArgumentException("group has no members"));
  }
}
