package dev.granary.api;

import dev.granary.storage.LocalAttachmentStorage;
import dev.granary.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Serves stored attachment files behind signed, expiring URLs. */
@RestController
public class FileController {

  private static final Logger log = LoggerFactory.getLogger(FileController.class);

  private final LocalAttachmentStorage storage;

  public FileController(LocalAttachmentStorage storage) {
    this.storage = storage;
  }

  @GetMapping("/files/announcements/{key}/{file}")
  public ResponseEntity<byte[]> download(
      @PathVariable String key,
      @PathVariable String file,
      @RequestParam long expires,
      @RequestParam String signature) {
    String path = "announcements/" + key + "/" + file;
    if (!storage.verify(path, expires, signature)) {
      log.debug("Rejected download of {}: bad or expired signature", path);
      return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }
    try {
      return ResponseEntity.ok()
          .contentType(MediaType.APPLICATION_OCTET_STREAM)
          .header("Content-Disposition", "attachment; filename=\"" + file + "\"")
          .body(storage.read(path));
    } catch (StorageException e) {
      log.debug("Download of {} failed: {}", path, e.getMessage());
      return ResponseEntity.notFound().build();
    }
  }
}
