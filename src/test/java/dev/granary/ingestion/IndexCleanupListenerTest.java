package dev.granary.ingestion;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import dev.granary.catalog.AnnouncementRemovedEvent;
import dev.granary.catalog.AttachmentRemovedEvent;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class IndexCleanupListenerTest {

  @Mock IndexingService indexingService;

  @InjectMocks IndexCleanupListener listener;

  @Test
  void removedAttachmentLosesItsChunks() {
    UUID attachmentId = UUID.randomUUID();

    listener.onAttachmentRemoved(
        new AttachmentRemovedEvent(attachmentId, UUID.randomUUID(), "announcements/k/1_a.pdf"));

    verify(indexingService).deleteChunks(IndexSourceType.ATTACHMENT, attachmentId);
  }

  @Test
  void removedAnnouncementLosesItsOwnAndItsAttachmentChunks() {
    UUID announcementId = UUID.randomUUID();
    UUID first = UUID.randomUUID();
    UUID second = UUID.randomUUID();

    listener.onAnnouncementRemoved(
        new AnnouncementRemovedEvent(announcementId, List.of(first, second)));

    verify(indexingService).deleteChunks(IndexSourceType.ANNOUNCEMENT, announcementId);
    verify(indexingService).deleteChunks(IndexSourceType.ATTACHMENT, first);
    verify(indexingService).deleteChunks(IndexSourceType.ATTACHMENT, second);
  }

  @Test
  void storeFailureDoesNotStopTheRemainingDeletes() {
    UUID announcementId = UUID.randomUUID();
    UUID attachmentId = UUID.randomUUID();
    doThrow(new IllegalStateException("store offline"))
        .when(indexingService)
        .deleteChunks(IndexSourceType.ANNOUNCEMENT, announcementId);

    assertThatCode(
            () ->
                listener.onAnnouncementRemoved(
                    new AnnouncementRemovedEvent(announcementId, List.of(attachmentId))))
        .doesNotThrowAnyException();
    verify(indexingService).deleteChunks(IndexSourceType.ATTACHMENT, attachmentId);
  }
}
