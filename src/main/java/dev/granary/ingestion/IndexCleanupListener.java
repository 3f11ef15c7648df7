package dev.granary.ingestion;

import dev.granary.catalog.AnnouncementRemovedEvent;
import dev.granary.catalog.AttachmentRemovedEvent;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Drops the search chunks of catalog rows once their removal has committed. A failed delete is
 * logged; the chunks then stay until the record is indexed again.
 */
@Component
public class IndexCleanupListener {

  private static final Logger log = LoggerFactory.getLogger(IndexCleanupListener.class);

  private final IndexingService indexingService;

  public IndexCleanupListener(IndexingService indexingService) {
    this.indexingService = indexingService;
  }

  @TransactionalEventListener
  public void onAttachmentRemoved(AttachmentRemovedEvent event) {
    deleteChunks(IndexSourceType.ATTACHMENT, event.attachmentId());
  }

  @TransactionalEventListener
  public void onAnnouncementRemoved(AnnouncementRemovedEvent event) {
    deleteChunks(IndexSourceType.ANNOUNCEMENT, event.announcementId());
    for (UUID attachmentId : event.attachmentIds()) {
      deleteChunks(IndexSourceType.ATTACHMENT, attachmentId);
    }
  }

  private void deleteChunks(IndexSourceType sourceType, UUID sourceId) {
    try {
      indexingService.deleteChunks(sourceType, sourceId);
      log.debug("Removed chunks of {} {}", sourceType.value(), sourceId);
    } catch (RuntimeException e) {
      log.warn(
          "Could not remove chunks of {} {}: {}", sourceType.value(), sourceId, e.getMessage());
    }
  }
}
