package dev.granary.catalog;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/** Spring Data repository for {@link Announcement} entities. */
public interface AnnouncementRepository extends JpaRepository<Announcement, UUID> {

  Optional<Announcement> findBySourceIdAndExternalId(UUID sourceId, String externalId);

  /**
   * Live announcements the dedup engine has not examined since their fingerprint, deadline or
   * group last changed, oldest first. Grouped rows appear here when they were handed back.
   */
  @Query(
      """
      SELECT a FROM Announcement a
      WHERE a.dedupedAt IS NULL AND a.deletedAt IS NULL
      ORDER BY a.createdAt ASC, a.id ASC
      """)
  List<Announcement> findDedupBacklog(Pageable page);

  Optional<Announcement>
      findFirstByNormalizedNameAndNormalizedOrgAndGroupIdIsNotNullAndDeletedAtIsNull(
          String normalizedName, String normalizedOrg);

  List<Announcement> findByNormalizedNameAndNormalizedOrgAndGroupIdIsNullAndDeletedAtIsNull(
      String normalizedName, String normalizedOrg);

  List<Announcement> findByGroupIdAndDeletedAtIsNull(UUID groupId);

  /** Live announcements whose search chunks are out of date, least recently updated first. */
  @Query(
      """
      SELECT a FROM Announcement a
      WHERE a.embeddingStale = true AND a.deletedAt IS NULL
      ORDER BY a.updatedAt ASC
      """)
  List<Announcement> findStaleForIndexing(Pageable page);
}
