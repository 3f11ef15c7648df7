package dev.granary.analysis;

import dev.granary.catalog.AnalysisStatus;
import dev.granary.catalog.AnnouncementFields;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.Attachment;
import dev.granary.catalog.AttachmentAnalysis;
import dev.granary.catalog.AttachmentDraft;
import dev.granary.catalog.AttachmentRepository;
import dev.granary.catalog.AttachmentRole;
import dev.granary.detail.AttachmentProperties;
import dev.granary.fetch.AttachmentDownloader;
import dev.granary.fetch.AttachmentTooLargeException;
import dev.granary.fetch.FetchException;
import dev.granary.persistence.RetryPolicy;
import dev.granary.storage.AttachmentStorage;
import dev.granary.storage.StorageException;
import java.time.Clock;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Drives attachment analysis and announcement field extraction.
 *
 * <p>During a crawl, {@link #analyzeContent} reads freshly downloaded bytes and {@link
 * #analyzeAnnouncement} extracts fields once per announcement. Outside a crawl, {@link
 * #requestReanalysis} moves an attachment to {@link AnalysisStatus#ANALYZING} and hands the work
 * to the {@link AnalysisTaskQueue}; the worker then runs {@link #analyze}.
 *
 * <p>A reanalysis that ends in {@link AnalysisStatus#ANALYZED} marks the parent announcement's
 * search chunks stale. A worker that aborts on an unexpected error still moves the attachment to
 * {@link AnalysisStatus#FAILED}, so it never stays in {@link AnalysisStatus#ANALYZING}.
 *
 * <p>Every repository call goes through the persistence {@link RetryPolicy}.
 */
@Service
public class AnalysisOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

  static final int MAX_ANALYSIS_TEXT_CHARS = 60_000;

  private final AttachmentRepository attachmentRepository;
  private final AnnouncementRepository announcementRepository;
  private final DocumentAnalyzer documentAnalyzer;
  private final AnnouncementFieldExtractor fieldExtractor;
  private final AttachmentStorage storage;
  private final AttachmentDownloader downloader;
  private final AnalysisTaskQueue taskQueue;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final long maxBytes;

  public AnalysisOrchestrator(
      AttachmentRepository attachmentRepository,
      AnnouncementRepository announcementRepository,
      DocumentAnalyzer documentAnalyzer,
      AnnouncementFieldExtractor fieldExtractor,
      AttachmentStorage storage,
      AttachmentDownloader downloader,
      AnalysisTaskQueue taskQueue,
      RetryPolicy retryPolicy,
      AttachmentProperties attachmentProperties,
      Clock clock) {
    this.attachmentRepository = attachmentRepository;
    this.announcementRepository = announcementRepository;
    this.documentAnalyzer = documentAnalyzer;
    this.fieldExtractor = fieldExtractor;
    this.storage = storage;
    this.downloader = downloader;
    this.taskQueue = taskQueue;
    this.retryPolicy = retryPolicy;
    this.clock = clock;
    this.maxBytes = attachmentProperties.maxStoredBytes();
  }

  /**
   * Analyzes document bytes.
   *
   * @param role attachment role, sent as the document type
   * @param bytes document content
   * @param mimeType document MIME type
   * @return parsed text, or the failure reason
   */
  public AttachmentAnalysis analyzeContent(AttachmentRole role, byte[] bytes, String mimeType) {
    AnalysisRequest request =
        new AnalysisRequest(
            role.documentType(), Base64.getEncoder().encodeToString(bytes), mimeType);
    return toOutcome(documentAnalyzer.analyze(request));
  }

  private static AttachmentAnalysis toOutcome(AnalysisResult result) {
    String text = result.success() ? result.extractedText() : null;
    if (text == null) {
      String error = result.error() != null ? result.error() : "Analyzer returned no content";
      return AttachmentAnalysis.failed(error);
    }
    return AttachmentAnalysis.parsed(text);
  }

  /**
   * Extracts structured fields from announcement text.
   *
   * @return the fields, or null when the text is blank or extraction failed
   */
  public @Nullable AnnouncementFields analyzeAnnouncement(String fullText) {
    if (fullText == null || fullText.isBlank()) {
      return null;
    }
    AnnouncementFields fields = fieldExtractor.extract(fullText);
    if (fields == null) {
      log.debug("Field extraction produced nothing for {} chars of text", fullText.length());
    }
    return fields;
  }

  /**
   * Joins the detail text with the parsed text of successfully analyzed attachments, highest
   * role priority first, capped at {@link #MAX_ANALYSIS_TEXT_CHARS}.
   */
  public static String composeAnalysisText(String detailText, List<AttachmentDraft> attachments) {
    StringBuilder sb = new StringBuilder(detailText == null ? "" : detailText.strip());
    attachments.stream()
        .filter(a -> a.analysis() != null && a.analysis().success())
        .sorted(Comparator.comparingInt((AttachmentDraft a) -> a.role().priority()).reversed())
        .forEach(
            a ->
                sb.append("\n\n[첨부: ")
                    .append(a.fileName())
                    .append("]\n")
                    .append(a.analysis().parsedContent()));
    return sb.length() > MAX_ANALYSIS_TEXT_CHARS
        ? sb.substring(0, MAX_ANALYSIS_TEXT_CHARS)
        : sb.toString();
  }

  /**
   * Accepts a reanalysis request and queues the work.
   *
   * @param attachmentId attachment to reanalyze
   * @param force permits reanalysis of an already analyzed attachment
   * @return a ticket in {@link AnalysisStatus#ANALYZING}
   * @throws NoSuchElementException when the attachment does not exist
   * @throws ReanalysisRejectedException when analysis is running, already done without force, or
   *     the queue is full
   */
  public ReanalysisTicket requestReanalysis(UUID attachmentId, boolean force) {
    Attachment attachment = load(attachmentId);
    AnalysisStatus current = attachment.getAnalysisStatus();
    if (current == AnalysisStatus.ANALYZING) {
      throw new ReanalysisRejectedException(attachmentId, "Analysis already in progress");
    }
    if (current == AnalysisStatus.ANALYZED && !force) {
      throw new ReanalysisRejectedException(
          attachmentId, "Attachment already analyzed; use force to reanalyze");
    }
    attachment.startAnalysis(force);
    save(attachment);

    try {
      taskQueue.submit(() -> runQueued(attachmentId));
    } catch (TaskRejectedException e) {
      attachment.failAnalysis("Analysis queue full");
      save(attachment);
      throw new ReanalysisRejectedException(attachmentId, "Analysis queue is full, try later");
    }
    log.info("Queued reanalysis of attachment {} (force={})", attachmentId, force);
    return new ReanalysisTicket(attachmentId, AnalysisStatus.ANALYZING, clock.instant());
  }

  private void runQueued(UUID attachmentId) {
    try {
      analyze(attachmentId);
    } catch (AnalysisException e) {
      log.warn("Reanalysis of attachment {} failed: {}", attachmentId, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Reanalysis of attachment {} aborted", attachmentId, e);
      failAborted(attachmentId, e);
    }
  }

  private void failAborted(UUID attachmentId, RuntimeException cause) {
    try {
      Attachment attachment = load(attachmentId);
      if (attachment.getAnalysisStatus() == AnalysisStatus.ANALYZING) {
        recordFailure(attachment, "Analysis aborted: " + cause.getMessage());
      }
    } catch (RuntimeException e) {
      log.error("Could not mark attachment {} as failed", attachmentId, e);
    }
  }

  /**
   * Analyzes an attachment that is in {@link AnalysisStatus#ANALYZING}: reads the bytes from
   * storage when stored, otherwise downloads them again, and records the outcome.
   *
   * @throws AnalysisException when the document could not be obtained or read
   */
  public AnalysisResult analyze(UUID attachmentId) {
    Attachment attachment = load(attachmentId);
    if (attachment.getAnalysisStatus() != AnalysisStatus.ANALYZING) {
      throw new IllegalStateException(
          "Attachment " + attachmentId + " is " + attachment.getAnalysisStatus());
    }

    byte[] bytes;
    try {
      bytes = readBytes(attachment);
    } catch (FetchException | AttachmentTooLargeException | StorageException e) {
      recordFailure(attachment, "Document unavailable: " + e.getMessage());
      throw new AnalysisException(attachmentId, "Document unavailable", e);
    }

    AnalysisRequest request =
        new AnalysisRequest(
            attachment.getRole().documentType(),
            Base64.getEncoder().encodeToString(bytes),
            attachment.getMimeType() != null
                ? attachment.getMimeType()
                : attachment.getFileType().mimeType());
    AnalysisResult result = documentAnalyzer.analyze(request);
    AttachmentAnalysis outcome = toOutcome(result);
    if (!outcome.success()) {
      recordFailure(attachment, outcome.error());
      throw new AnalysisException(attachmentId, outcome.error());
    }
    attachment.completeAnalysis(outcome.parsedContent());
    save(attachment);
    markAnnouncementStale(attachment.getAnnouncementId());
    log.info(
        "Analyzed attachment {} ({} chars)", attachmentId, outcome.parsedContent().length());
    return result;
  }

  private byte[] readBytes(Attachment attachment) {
    if (attachment.isStored()) {
      return storage.read(attachment.getStoragePath());
    }
    return downloader.download(attachment.getSourceUrl(), null, false, maxBytes);
  }

  private void markAnnouncementStale(UUID announcementId) {
    retryPolicy.run(
        "mark announcement stale " + announcementId,
        () ->
            announcementRepository
                .findById(announcementId)
                .ifPresent(
                    announcement -> {
                      announcement.markEmbeddingStale();
                      announcementRepository.save(announcement);
                    }));
  }

  private void recordFailure(Attachment attachment, String error) {
    attachment.failAnalysis(error);
    save(attachment);
  }

  private Attachment load(UUID attachmentId) {
    return retryPolicy
        .execute(
            "load attachment " + attachmentId, () -> attachmentRepository.findById(attachmentId))
        .orElseThrow(() -> new NoSuchElementException("Attachment not found: " + attachmentId));
  }

  private void save(Attachment attachment) {
    retryPolicy.execute(
        "save attachment " + attachment.getId(), () -> attachmentRepository.save(attachment));
  }
}
