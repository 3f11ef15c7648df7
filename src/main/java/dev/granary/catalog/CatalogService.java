package dev.granary.catalog;

import dev.granary.persistence.RetryPolicy;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes crawled announcements and their attachments into the catalog.
 *
 * <p>Each write runs in its own transaction, and the whole transaction is retried by the
 * persistence {@link RetryPolicy} when it fails transiently. Upserts key on {@code (sourceId,
 * externalId)} for announcements and on {@code (announcementId, sourceUrl)} for attachments, so a
 * re-crawl never creates duplicate rows.
 *
 * <p>Removals publish {@link AttachmentRemovedEvent} and {@link AnnouncementRemovedEvent} inside
 * the transaction; listeners clean up search chunks and stored files once it commits.
 */
@Service
public class CatalogService {

  private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

  private static final Comparator<Attachment> NEWEST_FIRST =
      Comparator.comparing(
              Attachment::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
          .thenComparing(Attachment::getId, Comparator.nullsFirst(Comparator.<UUID>naturalOrder()))
          .reversed();

  private final AnnouncementRepository announcementRepository;
  private final AttachmentRepository attachmentRepository;
  private final RetryPolicy retryPolicy;
  private final TransactionTemplate transactionTemplate;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public CatalogService(
      AnnouncementRepository announcementRepository,
      AttachmentRepository attachmentRepository,
      RetryPolicy retryPolicy,
      TransactionTemplate transactionTemplate,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.announcementRepository = announcementRepository;
    this.attachmentRepository = attachmentRepository;
    this.retryPolicy = retryPolicy;
    this.transactionTemplate = transactionTemplate;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Creates or updates an announcement and records its attachments.
   *
   * @param draft crawled announcement state
   * @param attachments attachments observed on the detail page
   * @return the announcement id and what changed
   */
  public UpsertOutcome upsert(AnnouncementDraft draft, List<AttachmentDraft> attachments) {
    AnnouncementDraft normalized = normalizeClassification(draft);
    return retryPolicy.execute(
        "upsert announcement " + draft.externalId(),
        () -> transactionTemplate.execute(status -> doUpsert(normalized, attachments)));
  }

  private UpsertOutcome doUpsert(AnnouncementDraft draft, List<AttachmentDraft> attachments) {
    Optional<Announcement> existing =
        announcementRepository.findBySourceIdAndExternalId(draft.sourceId(), draft.externalId());
    Announcement announcement =
        existing.orElseGet(() -> new Announcement(draft.sourceId(), draft.externalId()));
    announcement.applyDraft(draft, LocalDate.now(clock));
    Announcement saved = announcementRepository.save(announcement);

    int recorded = recordAttachments(saved.getId(), attachments);
    int removed = collapseDuplicates(saved.getId());
    log.debug(
        "{} announcement {} ({} attachments, {} duplicates removed)",
        existing.isPresent() ? "Updated" : "Created",
        saved.getId(),
        recorded,
        removed);
    return new UpsertOutcome(saved.getId(), existing.isEmpty(), recorded, removed);
  }

  private int recordAttachments(UUID announcementId, List<AttachmentDraft> drafts) {
    if (drafts.isEmpty()) {
      return 0;
    }
    Map<String, Attachment> bySourceUrl = new HashMap<>();
    attachmentRepository.findByAnnouncementId(announcementId).stream()
        .sorted(NEWEST_FIRST.reversed())
        .forEach(a -> bySourceUrl.put(a.getSourceUrl(), a));

    List<Attachment> toSave = new ArrayList<>();
    for (AttachmentDraft draft : drafts) {
      Attachment current = bySourceUrl.get(draft.sourceUrl());
      if (current == null) {
        current = new Attachment(announcementId, draft);
        bySourceUrl.put(draft.sourceUrl(), current);
      } else {
        current.refresh(draft);
      }
      if (!toSave.contains(current)) {
        toSave.add(current);
      }
    }
    attachmentRepository.saveAll(toSave);
    return toSave.size();
  }

  /**
   * Collapses attachments of one announcement that share a source URL, keeping the most recently
   * created row (ties: the larger id). Running it again removes nothing.
   *
   * @param announcementId the announcement to clean up
   * @return number of rows deleted
   */
  public int cleanupDuplicateAttachments(UUID announcementId) {
    Integer removed =
        retryPolicy.execute(
            "cleanup attachments of " + announcementId,
            () -> transactionTemplate.execute(status -> collapseDuplicates(announcementId)));
    return removed != null ? removed : 0;
  }

  private int collapseDuplicates(UUID announcementId) {
    Map<String, List<Attachment>> bySourceUrl = new HashMap<>();
    for (Attachment attachment : attachmentRepository.findByAnnouncementId(announcementId)) {
      bySourceUrl
          .computeIfAbsent(attachment.getSourceUrl(), k -> new ArrayList<>())
          .add(attachment);
    }
    List<Attachment> doomed = new ArrayList<>();
    for (List<Attachment> sameUrl : bySourceUrl.values()) {
      if (sameUrl.size() > 1) {
        sameUrl.sort(NEWEST_FIRST);
        doomed.addAll(sameUrl.subList(1, sameUrl.size()));
      }
    }
    if (!doomed.isEmpty()) {
      for (Attachment attachment : doomed) {
        eventPublisher.publishEvent(
            new AttachmentRemovedEvent(
                attachment.getId(), announcementId, attachment.getStoragePath()));
      }
      attachmentRepository.deleteAll(doomed);
      log.info(
          "Removed {} duplicate attachments of announcement {}", doomed.size(), announcementId);
    }
    return doomed.size();
  }

  /**
   * Soft-deletes an announcement. It leaves its group, and a remaining member is handed back to
   * the dedup backlog so the group's canonical is elected again.
   *
   * @return false when the announcement was already deleted
   * @throws NoSuchElementException if no announcement has the id
   */
  public boolean deleteAnnouncement(UUID announcementId) {
    Boolean deleted =
        retryPolicy.execute(
            "delete announcement " + announcementId,
            () -> transactionTemplate.execute(status -> softDelete(announcementId)));
    return Boolean.TRUE.equals(deleted);
  }

  private boolean softDelete(UUID announcementId) {
    Announcement announcement =
        announcementRepository
            .findById(announcementId)
            .orElseThrow(
                () -> new NoSuchElementException("Announcement not found: " + announcementId));
    if (announcement.getDeletedAt() != null) {
      return false;
    }
    UUID groupId = announcement.getGroupId();
    announcement.markDeleted(clock.instant());
    announcementRepository.save(announcement);
    if (groupId != null) {
      announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId).stream()
          .filter(member -> !member.getId().equals(announcementId))
          .findFirst()
          .ifPresent(
              member -> {
                member.requeueForDedup();
                announcementRepository.save(member);
              });
    }
    List<UUID> attachmentIds =
        attachmentRepository.findByAnnouncementId(announcementId).stream()
            .map(Attachment::getId)
            .toList();
    eventPublisher.publishEvent(new AnnouncementRemovedEvent(announcementId, attachmentIds));
    log.info("Deleted announcement {} (group {})", announcementId, groupId);
    return true;
  }

  public Optional<Announcement> findAnnouncement(UUID sourceId, String externalId) {
    return retryPolicy.execute(
        "find announcement " + externalId,
        () -> announcementRepository.findBySourceIdAndExternalId(sourceId, externalId));
  }

  public List<Attachment> findAttachments(UUID announcementId) {
    return retryPolicy.execute(
        "find attachments of " + announcementId,
        () -> attachmentRepository.findByAnnouncementId(announcementId));
  }

  /**
   * Loads an attachment.
   *
   * @throws NoSuchElementException if no attachment has the id
   */
  public Attachment getAttachment(UUID attachmentId) {
    return retryPolicy
        .execute(
            "load attachment " + attachmentId, () -> attachmentRepository.findById(attachmentId))
        .orElseThrow(() -> new NoSuchElementException("Attachment not found: " + attachmentId));
  }

  private static AnnouncementDraft normalizeClassification(AnnouncementDraft draft) {
    if (draft.fields() == null) {
      return draft;
    }
    AnnouncementFields fields =
        CatalogValidator.normalize(draft.fields(), draft.name(), draft.organization());
    return new AnnouncementDraft(
        draft.sourceId(),
        draft.externalId(),
        draft.name(),
        draft.organization(),
        draft.postedDate(),
        draft.detailUrl(),
        draft.contentHash(),
        draft.normalizedName(),
        draft.normalizedOrg(),
        fields);
  }
}
