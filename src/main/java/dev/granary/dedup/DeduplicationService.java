package dev.granary.dedup;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.GroupReviewStatus;
import dev.granary.catalog.ProjectGroup;
import dev.granary.catalog.ProjectGroupRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Groups announcements that share a fingerprint.
 *
 * <p>Each call examines one batch of the backlog (live, not yet deduplicated announcements,
 * oldest first) inside a single transaction. An ungrouped announcement joins an existing group
 * with the same fingerprint, founds a new group with every other ungrouped match, or stays a
 * canonical singleton. Matching is exact; there is no fuzzy comparison.
 *
 * <p>A grouped announcement is back in the backlog when its fingerprint or deadline changed, or
 * when another member was deleted. If some other member still shares its fingerprint the group is
 * reconciled; otherwise the announcement leaves the group and is matched again like an ungrouped
 * one. A group left with a single member is dissolved.
 *
 * <p>A {@link GroupReviewStatus#CONFIRMED} group keeps the canonical an operator chose for as long
 * as that member stays in the group.
 */
@Service
public class DeduplicationService {

  private static final Logger log = LoggerFactory.getLogger(DeduplicationService.class);

  private final AnnouncementRepository announcementRepository;
  private final ProjectGroupRepository groupRepository;
  private final double amountTolerance;
  private final Clock clock;

  public DeduplicationService(
      AnnouncementRepository announcementRepository,
      ProjectGroupRepository groupRepository,
      DedupProperties properties,
      Clock clock) {
    this.announcementRepository = announcementRepository;
    this.groupRepository = groupRepository;
    this.amountTolerance = properties.amountTolerance();
    this.clock = clock;
  }

  /**
   * Processes up to {@code batchSize} backlog announcements.
   *
   * @param batchSize maximum announcements to examine, at least 1
   * @return what the batch did; {@code processed == 0} means the backlog is empty
   */
  @Transactional
  public GroupingResult groupBatch(int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1, got: " + batchSize);
    }
    List<Announcement> backlog =
        announcementRepository.findDedupBacklog(PageRequest.of(0, batchSize));
    Instant now = clock.instant();
    int groupsCreated = 0;
    int projectsGrouped = 0;

    for (Announcement announcement : backlog) {
      if (announcement.getDedupedAt() != null) {
        // handled earlier in this batch as a group member
        continue;
      }
      Fingerprint fp =
          AnnouncementNormalizer.normalize(announcement.getName(), announcement.getOrganization());
      announcement.updateFingerprint(fp.normalizedName(), fp.normalizedOrg());

      if (announcement.getGroupId() != null) {
        if (stillMatchesGroup(announcement)) {
          reconcileGroup(announcement.getGroupId());
          announcement.markDeduped(now);
          continue;
        }
        leaveGroup(announcement);
      }

      Optional<Announcement> grouped =
          announcementRepository
              .findFirstByNormalizedNameAndNormalizedOrgAndGroupIdIsNotNullAndDeletedAtIsNull(
                  fp.normalizedName(), fp.normalizedOrg());
      if (grouped.isPresent()) {
        joinGroup(announcement, grouped.get().getGroupId());
        projectsGrouped++;
      } else {
        List<Announcement> siblings = ungroupedSiblings(announcement, fp);
        if (siblings.isEmpty()) {
          announcement.assignGroup(null, true);
        } else {
          siblings.add(0, announcement);
          createGroup(siblings, now);
          groupsCreated++;
          projectsGrouped += siblings.size();
        }
      }
      announcement.markDeduped(now);
    }

    announcementRepository.saveAll(backlog);
    GroupingResult result = new GroupingResult(backlog.size(), groupsCreated, projectsGrouped);
    if (result.processed() > 0) {
      log.info(
          "Dedup batch: {} processed, {} groups created, {} grouped",
          result.processed(),
          result.groupsCreated(),
          result.projectsGrouped());
    }
    return result;
  }

  private List<Announcement> ungroupedSiblings(Announcement announcement, Fingerprint fp) {
    List<Announcement> siblings = new ArrayList<>();
    for (Announcement candidate :
        announcementRepository
            .findByNormalizedNameAndNormalizedOrgAndGroupIdIsNullAndDeletedAtIsNull(
                fp.normalizedName(), fp.normalizedOrg())) {
      if (!sameRow(candidate, announcement)) {
        siblings.add(candidate);
      }
    }
    return siblings;
  }

  private boolean stillMatchesGroup(Announcement announcement) {
    List<Announcement> members =
        announcementRepository.findByGroupIdAndDeletedAtIsNull(announcement.getGroupId());
    return members.stream()
        .filter(member -> !sameRow(member, announcement))
        .anyMatch(
            member ->
                Objects.equals(member.getNormalizedName(), announcement.getNormalizedName())
                    && Objects.equals(member.getNormalizedOrg(), announcement.getNormalizedOrg()));
  }

  private void reconcileGroup(UUID groupId) {
    ProjectGroup group = loadGroup(groupId);
    List<Announcement> members = announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId);
    reconcile(group, members);
    announcementRepository.saveAll(members);
    log.debug("Reconciled group {} ({} members)", groupId, members.size());
  }

  /** Takes the announcement out of its group; the rest is reconciled or dissolved. */
  private void leaveGroup(Announcement announcement) {
    UUID groupId = announcement.getGroupId();
    ProjectGroup group = loadGroup(groupId);
    announcement.assignGroup(null, true);
    List<Announcement> remaining = new ArrayList<>();
    for (Announcement member : announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId)) {
      if (!sameRow(member, announcement)) {
        remaining.add(member);
      }
    }
    if (remaining.size() >= 2) {
      reconcile(group, remaining);
    } else {
      for (Announcement member : remaining) {
        member.assignGroup(null, true);
      }
      groupRepository.delete(group);
      log.debug("Dissolved group {}", groupId);
    }
    announcementRepository.saveAll(remaining);
    log.debug("Announcement {} left group {}", announcement.getId(), groupId);
  }

  private static boolean sameRow(Announcement a, Announcement b) {
    return a == b || (a.getId() != null && a.getId().equals(b.getId()));
  }

  private ProjectGroup loadGroup(UUID groupId) {
    return groupRepository
        .findById(groupId)
        .orElseThrow(() -> new IllegalStateException("Missing project group " + groupId));
  }

  private void joinGroup(Announcement announcement, UUID groupId) {
    ProjectGroup group = loadGroup(groupId);
    announcement.assignGroup(groupId, false);
    List<Announcement> members =
        new ArrayList<>(announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId));
    if (!members.contains(announcement)) {
      members.add(announcement);
    }
    reconcile(group, members);
    announcementRepository.saveAll(members);
    log.debug("Announcement {} joined group {}", announcement.getId(), groupId);
  }

  private void createGroup(List<Announcement> members, Instant now) {
    ProjectGroup group = groupRepository.save(new ProjectGroup());
    for (Announcement member : members) {
      member.assignGroup(group.getId(), false);
      member.markDeduped(now);
    }
    reconcile(group, members);
    announcementRepository.saveAll(members);
    log.debug("Created group {} with {} members", group.getId(), members.size());
  }

  /** Re-elects the canonical member, merges missing fields into it and re-checks review need. */
  private void reconcile(ProjectGroup group, List<Announcement> members) {
    Announcement canonical = electCanonical(group, members);
    for (Announcement member : members) {
      member.assignGroup(group.getId(), member == canonical);
    }
    for (Announcement member : members) {
      if (member != canonical) {
        canonical.mergeMissingFrom(member);
      }
    }
    group.setCanonicalAnnouncementId(canonical.getId());
    if (GroupReviewPolicy.needsReview(members, amountTolerance)) {
      group.flagForReview();
    }
    groupRepository.save(group);
  }

  private static Announcement electCanonical(ProjectGroup group, List<Announcement> members) {
    if (group.getReviewStatus() == GroupReviewStatus.CONFIRMED
        && group.getCanonicalAnnouncementId() != null) {
      for (Announcement member : members) {
        if (group.getCanonicalAnnouncementId().equals(member.getId())) {
          return member;
        }
      }
    }
    return CanonicalSelector.select(members);
  }
}
