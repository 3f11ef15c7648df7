package dev.granary.crawl;

import dev.granary.analysis.AnalysisOrchestrator;
import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementDraft;
import dev.granary.catalog.AnnouncementFields;
import dev.granary.catalog.Attachment;
import dev.granary.catalog.AttachmentDraft;
import dev.granary.catalog.CatalogService;
import dev.granary.catalog.UpsertOutcome;
import dev.granary.dedup.AnnouncementNormalizer;
import dev.granary.dedup.Fingerprint;
import dev.granary.detail.DetailPage;
import dev.granary.detail.DetailResolver;
import dev.granary.fetch.FetchAdapter;
import dev.granary.fetch.FetchOptions;
import dev.granary.listing.ListingCandidate;
import dev.granary.source.AdapterType;
import dev.granary.source.Source;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Processes one listing candidate end to end: detail page, attachments, field extraction,
 * fingerprint and catalog upsert.
 */
@Component
public class AnnouncementPipeline {

  private static final Logger log = LoggerFactory.getLogger(AnnouncementPipeline.class);

  private final DetailResolver detailResolver;
  private final FetchAdapter fetchAdapter;
  private final AttachmentIntake attachmentIntake;
  private final AnalysisOrchestrator analysisOrchestrator;
  private final CatalogService catalogService;

  public AnnouncementPipeline(
      DetailResolver detailResolver,
      FetchAdapter fetchAdapter,
      AttachmentIntake attachmentIntake,
      AnalysisOrchestrator analysisOrchestrator,
      CatalogService catalogService) {
    this.detailResolver = detailResolver;
    this.fetchAdapter = fetchAdapter;
    this.attachmentIntake = attachmentIntake;
    this.analysisOrchestrator = analysisOrchestrator;
    this.catalogService = catalogService;
  }

  /**
   * Crawls and stores one announcement.
   *
   * @param source the source the candidate was listed on
   * @param candidate a valid listing candidate
   * @return the upsert outcome
   * @throws dev.granary.detail.DetailFetchException when the detail page cannot be fetched
   */
  public UpsertOutcome process(Source source, ListingCandidate candidate) {
    String link = UrlNormalizer.normalize(candidate.detailLink());
    String externalId = ContentHasher.externalId(link);
    FetchOptions options =
        source.getAdapterType() == AdapterType.BROWSER
            ? FetchOptions.browser(null)
            : FetchOptions.defaults();

    DetailPage page = detailResolver.resolveDetail(link, options);

    Optional<Announcement> existing = catalogService.findAnnouncement(source.getId(), externalId);
    Map<String, Attachment> known =
        existing.map(a -> knownAttachments(catalogService.findAttachments(a.getId())))
            .orElse(Map.of());

    List<AttachmentDraft> attachments =
        attachmentIntake.process(
            page.attachments(),
            externalId,
            page.finalUrl(),
            fetchAdapter.usesBrowser(link, options),
            known);

    String analysisText = AnalysisOrchestrator.composeAnalysisText(page.fullText(), attachments);
    String contentHash = ContentHasher.sha256(analysisText);
    AnnouncementFields fields = null;
    if (existing.isPresent() && contentHash.equals(existing.get().getContentHash())) {
      log.debug("Content unchanged for {}, skipping field extraction", link);
    } else {
      fields = analysisOrchestrator.analyzeAnnouncement(analysisText);
    }

    String title = candidate.title().strip();
    String organization =
        firstNonBlank(
            candidate.organization(),
            fields != null ? fields.organization() : null,
            source.getName());
    Fingerprint fingerprint = AnnouncementNormalizer.normalize(title, organization);

    AnnouncementDraft draft =
        new AnnouncementDraft(
            source.getId(),
            externalId,
            title,
            organization,
            candidate.date(),
            link,
            contentHash,
            fingerprint.normalizedName(),
            fingerprint.normalizedOrg(),
            fields);
    return catalogService.upsert(draft, attachments);
  }

  /** Newest attachment per source URL. */
  private static Map<String, Attachment> knownAttachments(List<Attachment> attachments) {
    Map<String, Attachment> bySourceUrl = new LinkedHashMap<>();
    attachments.stream()
        .sorted(
            Comparator.comparing(
                Attachment::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
        .forEach(a -> bySourceUrl.put(a.getSourceUrl(), a));
    return bySourceUrl;
  }

  private static @Nullable String firstNonBlank(@Nullable String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.strip();
      }
    }
    return null;
  }
}
