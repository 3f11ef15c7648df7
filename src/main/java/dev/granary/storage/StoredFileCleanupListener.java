package dev.granary.storage;

import dev.granary.catalog.AttachmentRemovedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/** Deletes the stored file of an attachment row once its removal has committed. */
@Component
public class StoredFileCleanupListener {

  private static final Logger log = LoggerFactory.getLogger(StoredFileCleanupListener.class);

  private final AttachmentStorage storage;

  public StoredFileCleanupListener(AttachmentStorage storage) {
    this.storage = storage;
  }

  @TransactionalEventListener
  public void onAttachmentRemoved(AttachmentRemovedEvent event) {
    String path = event.storagePath();
    if (path == null) {
      return;
    }
    try {
      storage.delete(path);
      log.debug("Deleted stored file {} of attachment {}", path, event.attachmentId());
    } catch (StorageException | IllegalArgumentException e) {
      log.warn("Could not delete stored file {}: {}", path, e.getMessage());
    }
  }
}
