package dev.granary.api;

import dev.granary.analysis.AnalysisOrchestrator;
import dev.granary.analysis.ReanalysisTicket;
import dev.granary.catalog.CatalogService;
import dev.granary.storage.AttachmentLinks;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Attachment download links and reanalysis requests. */
@RestController
@RequestMapping("/api/attachments")
public class AttachmentController {

  private final CatalogService catalogService;
  private final AttachmentLinks attachmentLinks;
  private final AnalysisOrchestrator analysisOrchestrator;

  public AttachmentController(
      CatalogService catalogService,
      AttachmentLinks attachmentLinks,
      AnalysisOrchestrator analysisOrchestrator) {
    this.catalogService = catalogService;
    this.attachmentLinks = attachmentLinks;
    this.analysisOrchestrator = analysisOrchestrator;
  }

  /** Signed storage URL for stored attachments, the original URL otherwise. */
  @GetMapping("/{id}/download-url")
  public Map<String, String> downloadUrl(@PathVariable UUID id) {
    return Map.of("url", attachmentLinks.downloadUrl(catalogService.getAttachment(id)));
  }

  /** Queues a reanalysis; 409 while analyzing, or when already analyzed and not forced. */
  @PostMapping("/{id}/reanalyze")
  public ResponseEntity<ReanalysisTicket> reanalyze(
      @PathVariable UUID id, @RequestParam(defaultValue = "false") boolean force) {
    return ResponseEntity.accepted().body(analysisOrchestrator.requestReanalysis(id, force));
  }
}
