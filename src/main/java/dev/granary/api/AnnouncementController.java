package dev.granary.api;

import dev.granary.catalog.CatalogService;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Soft delete of announcements withdrawn by their publisher. */
@RestController
@RequestMapping("/api/announcements")
public class AnnouncementController {

  private final CatalogService catalogService;

  public AnnouncementController(CatalogService catalogService) {
    this.catalogService = catalogService;
  }

  /** 204 whether or not the announcement was already deleted; 404 when unknown. */
  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    catalogService.deleteAnnouncement(id);
    return ResponseEntity.noContent().build();
  }
}
