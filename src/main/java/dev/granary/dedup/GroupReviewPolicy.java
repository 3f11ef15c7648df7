package dev.granary.dedup;

import dev.granary.catalog.Announcement;
import java.util.Collection;
import java.util.Objects;

/**
 * Flags groups whose members disagree enough that an automatic merge is doubtful: different
 * categories, or maximum amounts spread further apart than the tolerance.
 */
public final class GroupReviewPolicy {

  private GroupReviewPolicy() {
    // utility class
  }

  /**
   * @param members group members
   * @param amountTolerance allowed {@code (max - min) / max} of {@code amountMax}
   * @return true when the group should be reviewed manually
   */
  public static boolean needsReview(Collection<Announcement> members, double amountTolerance) {
    long categories =
        members.stream().map(Announcement::getCategory).filter(Objects::nonNull).distinct().count();
    if (categories > 1) {
      return true;
    }
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    int withAmount = 0;
    for (Announcement member : members) {
      Long amount = member.getAmountMax();
      if (amount != null) {
        min = Math.min(min, amount);
        max = Math.max(max, amount);
        withAmount++;
      }
    }
    if (withAmount < 2 || max <= 0) {
      return false;
    }
    return (double) (max - min) / max > amountTolerance;
  }
}
