package dev.granary.api;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.GroupReviewStatus;
import dev.granary.dedup.ReviewedGroup;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** REST view of a project group and its live members. */
public record ProjectGroupView(
    UUID id,
    GroupReviewStatus reviewStatus,
    @Nullable UUID canonicalAnnouncementId,
    List<Member> members) {

  /** One member announcement. */
  public record Member(
      UUID id,
      UUID sourceId,
      String name,
      @Nullable String organization,
      @Nullable LocalDate deadline,
      boolean canonical) {

    static Member from(Announcement announcement) {
      return new Member(
          announcement.getId(),
          announcement.getSourceId(),
          announcement.getName(),
          announcement.getOrganization(),
          announcement.getDeadline(),
          announcement.isCanonical());
    }
  }

  static ProjectGroupView from(ReviewedGroup reviewed) {
    return new ProjectGroupView(
        reviewed.group().getId(),
        reviewed.group().getReviewStatus(),
        reviewed.group().getCanonicalAnnouncementId(),
        reviewed.members().stream().map(Member::from).toList());
  }
}
