package dev.granary.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.when;

import dev.granary.catalog.CatalogService;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class AnnouncementControllerTest {

  @Mock CatalogService catalogService;
  @InjectMocks AnnouncementController controller;

  @Test
  void repeatedDeleteStillAnswersNoContent() {
    UUID id = UUID.randomUUID();
    when(catalogService.deleteAnnouncement(id)).thenReturn(false);

    assertThat(controller.delete(id).getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
  }

  @Test
  void unknownAnnouncementPropagatesNotFound() {
    UUID id = UUID.randomUUID();
    when(catalogService.deleteAnnouncement(id))
        .thenThrow(new NoSuchElementException("Announcement not found: " + id));

    assertThatExceptionOfType(NoSuchElementException.class)
        .isThrownBy(() -> controller.delete(id));
  }
}
