package dev.granary.dedup;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.GroupReviewStatus;
import dev.granary.catalog.ProjectGroup;
import dev.granary.catalog.ProjectGroupRepository;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator decisions on project groups: set the review status, pick the canonical member, or
 * dissolve a wrong merge.
 *
 * <p>A group confirmed by an operator keeps its canonical member through later dedup runs. A
 * dissolved group's members stay deduplicated, so the next dedup run does not merge them again
 * unless one of them changes.
 */
@Service
public class GroupReviewService {

  private static final Logger log = LoggerFactory.getLogger(GroupReviewService.class);

  private final ProjectGroupRepository groupRepository;
  private final AnnouncementRepository announcementRepository;

  public GroupReviewService(
      ProjectGroupRepository groupRepository, AnnouncementRepository announcementRepository) {
    this.groupRepository = groupRepository;
    this.announcementRepository = announcementRepository;
  }

  /**
   * @throws NoSuchElementException when the group does not exist
   */
  @Transactional(readOnly = true)
  public ReviewedGroup getGroup(UUID groupId) {
    ProjectGroup group = loadGroup(groupId);
    List<Announcement> members = announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId);
    return new ReviewedGroup(group, members);
  }

  /**
   * Applies an operator review. Either argument may be null to leave that part unchanged.
   *
   * @param reviewStatus new review status
   * @param canonicalAnnouncementId live member to make canonical
   * @throws NoSuchElementException when the group does not exist
   * @throws IllegalArgumentException when the announcement is not a live member of the group
   */
  @Transactional
  public ReviewedGroup review(
      UUID groupId,
      @Nullable GroupReviewStatus reviewStatus,
      @Nullable UUID canonicalAnnouncementId) {
    ProjectGroup group = loadGroup(groupId);
    List<Announcement> members = announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId);
    if (canonicalAnnouncementId != null) {
      boolean member =
          members.stream().anyMatch(a -> canonicalAnnouncementId.equals(a.getId()));
      if (!member) {
        throw new IllegalArgumentException(
            "Announcement " + canonicalAnnouncementId + " is not a member of group " + groupId);
      }
      for (Announcement announcement : members) {
        announcement.assignGroup(groupId, canonicalAnnouncementId.equals(announcement.getId()));
      }
      group.setCanonicalAnnouncementId(canonicalAnnouncementId);
      announcementRepository.saveAll(members);
    }
    if (reviewStatus != null) {
      group.review(reviewStatus);
    }
    groupRepository.save(group);
    log.info(
        "Reviewed group {}: status {}, canonical {}",
        groupId,
        group.getReviewStatus(),
        group.getCanonicalAnnouncementId());
    return new ReviewedGroup(group, members);
  }

  /**
   * Splits a group back into canonical singletons and deletes it.
   *
   * @return the number of members released
   * @throws NoSuchElementException when the group does not exist
   */
  @Transactional
  public int dissolve(UUID groupId) {
    ProjectGroup group = loadGroup(groupId);
    List<Announcement> members = announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId);
    for (Announcement member : members) {
      member.assignGroup(null, true);
    }
    announcementRepository.saveAll(members);
    groupRepository.delete(group);
    log.info("Dissolved group {} ({} members)", groupId, members.size());
    return members.size();
  }

  private ProjectGroup loadGroup(UUID groupId) {
    return groupRepository
        .findById(groupId)
        .orElseThrow(() -> new NoSuchElementException("Project group not found: " + groupId));
  }
}
