package dev.granary.crawl;

import dev.granary.analysis.AnalysisOrchestrator;
import dev.granary.catalog.AnalysisStatus;
import dev.granary.catalog.Attachment;
import dev.granary.catalog.AttachmentAnalysis;
import dev.granary.catalog.AttachmentDraft;
import dev.granary.detail.AttachmentLink;
import dev.granary.detail.AttachmentProperties;
import dev.granary.fetch.AttachmentDownloader;
import dev.granary.fetch.AttachmentTooLargeException;
import dev.granary.fetch.FetchException;
import dev.granary.storage.AttachmentStorage;
import dev.granary.storage.StorageException;
import dev.granary.storage.StorageUpload;
import dev.granary.storage.StoredFile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the attachment links of a detail page into drafts: links the selective storage policy
 * rejects stay remote-only, the others are downloaded within the size ceiling, stored and
 * analyzed.
 *
 * <p>A download, storage or analysis failure only affects its own attachment.
 */
@Component
public class AttachmentIntake {

  private static final Logger log = LoggerFactory.getLogger(AttachmentIntake.class);

  private final AttachmentDownloader downloader;
  private final AttachmentStorage storage;
  private final AnalysisOrchestrator analysisOrchestrator;
  private final long maxStoredBytes;

  public AttachmentIntake(
      AttachmentDownloader downloader,
      AttachmentStorage storage,
      AnalysisOrchestrator analysisOrchestrator,
      AttachmentProperties properties) {
    this.downloader = downloader;
    this.storage = storage;
    this.analysisOrchestrator = analysisOrchestrator;
    this.maxStoredBytes = properties.maxStoredBytes();
  }

  /**
   * Processes the links of one detail page.
   *
   * @param links attachment links in page order
   * @param announcementKey storage prefix shared by the announcement's files
   * @param referer detail page URL, sent with downloads
   * @param viaBrowser download through the shared browser
   * @param known attachments already recorded for the announcement, keyed by source URL
   * @return one draft per link
   */
  public List<AttachmentDraft> process(
      List<AttachmentLink> links,
      String announcementKey,
      @Nullable String referer,
      boolean viaBrowser,
      Map<String, Attachment> known) {
    List<AttachmentDraft> drafts = new ArrayList<>(links.size());
    for (AttachmentLink link : links) {
      drafts.add(intake(link, announcementKey, referer, viaBrowser, known.get(link.url())));
    }
    return drafts;
  }

  private AttachmentDraft intake(
      AttachmentLink link,
      String announcementKey,
      @Nullable String referer,
      boolean viaBrowser,
      @Nullable Attachment existing) {
    AttachmentDraft remoteOnly = draft(link, existing != null ? existing.getStoragePath() : null);
    if (!link.shouldParse()) {
      log.debug("Not storing {} ({})", link.fileName(), link.type());
      return remoteOnly;
    }
    if (existing != null
        && existing.isStored()
        && existing.getAnalysisStatus() == AnalysisStatus.ANALYZED
        && existing.getParsedContent() != null) {
      log.debug("Reusing analyzed attachment {}", existing.getId());
      return remoteOnly.withAnalysis(AttachmentAnalysis.parsed(existing.getParsedContent()));
    }

    String storagePath = existing != null && existing.isStored() ? existing.getStoragePath() : null;
    byte[] bytes = storagePath != null ? readStored(storagePath) : null;
    if (bytes == null) {
      bytes = download(link, referer, viaBrowser);
      if (bytes == null) {
        return remoteOnly;
      }
      StoredFile stored =
          storage.upload(
              new StorageUpload(announcementKey, link.fileName(), bytes, link.mimeType()));
      if (!stored.success()) {
        log.warn("Storing {} failed: {}", link.url(), stored.error());
        return remoteOnly;
      }
      storagePath = stored.filePath();
    }

    AttachmentAnalysis analysis =
        analysisOrchestrator.analyzeContent(link.role(), bytes, link.mimeType());
    if (!analysis.success()) {
      log.warn("Analysis of {} failed: {}", link.fileName(), analysis.error());
    }
    return draft(link, storagePath).withAnalysis(analysis);
  }

  private byte @Nullable [] download(
      AttachmentLink link, @Nullable String referer, boolean viaBrowser) {
    try {
      return downloader.download(link.url(), referer, viaBrowser, maxStoredBytes);
    } catch (AttachmentTooLargeException e) {
      log.info("Skipping oversized attachment {}: {}", link.url(), e.getMessage());
      return null;
    } catch (FetchException e) {
      log.warn("Downloading {} failed ({}): {}", link.url(), e.getKind(), e.getMessage());
      return null;
    }
  }

  private byte @Nullable [] readStored(String path) {
    try {
      return storage.read(path);
    } catch (StorageException e) {
      log.warn("Stored file {} unreadable, downloading again: {}", path, e.getMessage());
      return null;
    }
  }

  private static AttachmentDraft draft(AttachmentLink link, @Nullable String storagePath) {
    return new AttachmentDraft(
        link.fileName(),
        link.url(),
        link.type(),
        link.mimeType(),
        link.role(),
        link.sizeBytes(),
        link.shouldParse(),
        storagePath,
        null);
  }
}
