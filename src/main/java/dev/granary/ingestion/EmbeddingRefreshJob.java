package dev.granary.ingestion;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.Attachment;
import dev.granary.catalog.AttachmentRepository;
import dev.granary.persistence.RetryPolicy;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-indexes announcements whose {@code embeddingStale} flag is set, together with the parsed
 * text of their analyzed attachments.
 */
@Component
public class EmbeddingRefreshJob {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingRefreshJob.class);

  private final AnnouncementRepository announcementRepository;
  private final AttachmentRepository attachmentRepository;
  private final IndexingService indexingService;
  private final RetryPolicy retryPolicy;
  private final int batchSize;

  public EmbeddingRefreshJob(
      AnnouncementRepository announcementRepository,
      AttachmentRepository attachmentRepository,
      IndexingService indexingService,
      RetryPolicy retryPolicy,
      IndexingProperties properties) {
    this.announcementRepository = announcementRepository;
    this.attachmentRepository = attachmentRepository;
    this.indexingService = indexingService;
    this.retryPolicy = retryPolicy;
    this.batchSize = properties.refreshBatchSize();
  }

  @Scheduled(
      fixedDelayString = "${granary.indexing.refresh-interval-ms}",
      initialDelayString = "${granary.indexing.refresh-interval-ms}")
  public void scheduledRefresh() {
    refreshStale();
  }

  /**
   * Re-indexes one batch of stale announcements. A failure on one announcement is logged and the
   * announcement stays stale for the next run.
   *
   * @return number of announcements re-indexed
   */
  public int refreshStale() {
    List<Announcement> stale =
        retryPolicy.execute(
            "load stale announcements",
            () -> announcementRepository.findStaleForIndexing(PageRequest.of(0, batchSize)));
    int refreshed = 0;
    for (Announcement announcement : stale) {
      try {
        refresh(announcement);
        refreshed++;
      } catch (RuntimeException e) {
        log.warn("Re-indexing announcement {} failed: {}", announcement.getId(), e.getMessage());
      }
    }
    if (!stale.isEmpty()) {
      log.info("Re-indexed {}/{} stale announcements", refreshed, stale.size());
    }
    return refreshed;
  }

  private void refresh(Announcement announcement) {
    int chunks =
        indexingService.replaceChunks(
            IndexSourceType.ANNOUNCEMENT, announcement.getId(), indexText(announcement));
    List<Attachment> attachments =
        retryPolicy.execute(
            "load attachments of " + announcement.getId(),
            () -> attachmentRepository.findByAnnouncementId(announcement.getId()));
    for (Attachment attachment : attachments) {
      if (attachment.isParsed() && attachment.getParsedContent() != null) {
        chunks +=
            indexingService.replaceChunks(
                IndexSourceType.ATTACHMENT, attachment.getId(), attachment.getParsedContent());
      } else {
        indexingService.deleteChunks(IndexSourceType.ATTACHMENT, attachment.getId());
      }
    }
    announcement.markEmbedded();
    retryPolicy.execute(
        "mark announcement embedded " + announcement.getId(),
        () -> announcementRepository.save(announcement));
    log.debug("Re-indexed announcement {} ({} chunks)", announcement.getId(), chunks);
  }

  /** Text indexed for an announcement: its title, organization and descriptive fields. */
  static String indexText(Announcement announcement) {
    StringJoiner joiner = new StringJoiner("\n");
    add(joiner, announcement.getName());
    add(joiner, announcement.getOrganization());
    add(joiner, announcement.getSummary());
    add(joiner, announcement.getDescription());
    add(joiner, announcement.getEligibility());
    add(joiner, announcement.getApplicationProcess());
    add(joiner, announcement.getEvaluationCriteria());
    add(joiner, announcement.getContactInfo());
    return joiner.toString();
  }

  private static void add(StringJoiner joiner, String value) {
    if (value != null && !value.isBlank()) {
      joiner.add(value.strip());
    }
  }
}
