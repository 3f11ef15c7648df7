package dev.granary.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.granary.BaseIntegrationTest;
import dev.granary.fixture.AnnouncementBuilder;
import dev.granary.fixture.AttachmentBuilder;
import dev.granary.ingestion.IndexSourceType;
import dev.granary.ingestion.IndexingService;
import dev.granary.search.HybridSearchRequest;
import dev.granary.search.HybridSearchResult;
import dev.granary.search.HybridSearchService;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import dev.granary.storage.AttachmentStorage;
import dev.granary.storage.StorageException;
import dev.granary.storage.StorageUpload;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class CatalogServiceIT extends BaseIntegrationTest {

  @Autowired CatalogService catalogService;
  @Autowired SourceRepository sourceRepository;
  @Autowired AttachmentRepository attachmentRepository;
  @Autowired AnnouncementRepository announcementRepository;
  @Autowired IndexingService indexingService;
  @Autowired HybridSearchService hybridSearchService;
  @Autowired AttachmentStorage storage;

  private Source source;

  @BeforeEach
  void createSource() {
    source =
        sourceRepository.save(
            new Source("https://catalog.example.go.kr/" + UUID.randomUUID(), "테스트기관"));
  }

  @Test
  void secondUpsertOfSameExternalIdUpdatesInPlace() {
    AnnouncementBuilder builder =
        new AnnouncementBuilder().sourceId(source.getId()).externalId("ext-" + UUID.randomUUID());

    UpsertOutcome first = catalogService.upsert(builder.draft(), List.of());
    UpsertOutcome second =
        catalogService.upsert(
            builder.name("2024년 청년창업 지원사업 재공고").contentHash("hash-2").draft(), List.of());

    assertThat(first.created()).isTrue();
    assertThat(second.created()).isFalse();
    assertThat(second.announcementId()).isEqualTo(first.announcementId());
    Announcement stored =
        catalogService
            .findAnnouncement(source.getId(), builder.draft().externalId())
            .orElseThrow();
    assertThat(stored.getName()).isEqualTo("2024년 청년창업 지원사업 재공고");
    assertThat(stored.getContentHash()).isEqualTo("hash-2");
  }

  @Test
  void attachmentsAreRecordedOncePerSourceUrl() {
    AnnouncementBuilder builder =
        new AnnouncementBuilder().sourceId(source.getId()).externalId("ext-" + UUID.randomUUID());
    AttachmentDraft notice = new AttachmentBuilder().sourceUrl("https://x.go.kr/a.pdf").draft();
    AttachmentDraft form =
        new AttachmentBuilder()
            .sourceUrl("https://x.go.kr/b.hwp")
            .fileName("신청서.hwp")
            .type(AttachmentType.HWP)
            .role(AttachmentRole.APPLICATION_FORM)
            .draft();

    UpsertOutcome first = catalogService.upsert(builder.draft(), List.of(notice, form));
    catalogService.upsert(builder.draft(), List.of(notice));

    List<Attachment> attachments = catalogService.findAttachments(first.announcementId());
    assertThat(attachments)
        .extracting(Attachment::getSourceUrl)
        .containsExactlyInAnyOrder("https://x.go.kr/a.pdf", "https://x.go.kr/b.hwp");
  }

  @Test
  void cleanupCollapsesRowsSharingSourceUrl() {
    UpsertOutcome outcome =
        catalogService.upsert(
            new AnnouncementBuilder()
                .sourceId(source.getId())
                .externalId("ext-" + UUID.randomUUID())
                .draft(),
            List.of());
    UUID announcementId = outcome.announcementId();
    Attachment first =
        attachmentRepository.save(
            new AttachmentBuilder().id(null).announcementId(announcementId).build());
    Attachment second =
        attachmentRepository.save(
            new AttachmentBuilder().id(null).announcementId(announcementId).build());

    assertThat(catalogService.cleanupDuplicateAttachments(announcementId)).isEqualTo(1);
    assertThat(catalogService.cleanupDuplicateAttachments(announcementId)).isZero();
    assertThat(catalogService.findAttachments(announcementId))
        .singleElement()
        .extracting(Attachment::getId)
        .isIn(first.getId(), second.getId());
  }

  @Test
  void cleanupDropsChunksAndFilesOfRemovedRows() {
    UUID announcementId =
        catalogService
            .upsert(
                new AnnouncementBuilder()
                    .sourceId(source.getId())
                    .externalId("ext-" + UUID.randomUUID())
                    .draft(),
                List.of())
            .announcementId();
    Attachment first = storedCopy(announcementId);
    Attachment second = storedCopy(announcementId);
    String text = "Export voucher notice for small manufacturers entering overseas markets.";
    indexingService.replaceChunks(IndexSourceType.ATTACHMENT, first.getId(), text);
    indexingService.replaceChunks(IndexSourceType.ATTACHMENT, second.getId(), text);

    catalogService.cleanupDuplicateAttachments(announcementId);

    Attachment survivor = catalogService.findAttachments(announcementId).get(0);
    Attachment removed = survivor.getId().equals(first.getId()) ? second : first;
    assertThat(indexedIds(text)).contains(survivor.getId()).doesNotContain(removed.getId());
    assertThat(storage.read(survivor.getStoragePath())).isNotEmpty();
    assertThatThrownBy(() -> storage.read(removed.getStoragePath()))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void deletedAnnouncementDisappearsFromSearch() {
    UUID announcementId =
        catalogService
            .upsert(
                new AnnouncementBuilder()
                    .sourceId(source.getId())
                    .externalId("ext-" + UUID.randomUUID())
                    .draft(),
                List.of())
            .announcementId();
    String text = "Smart factory subsidy for automation equipment and sensors.";
    indexingService.replaceChunks(IndexSourceType.ANNOUNCEMENT, announcementId, text);

    assertThat(catalogService.deleteAnnouncement(announcementId)).isTrue();
    assertThat(catalogService.deleteAnnouncement(announcementId)).isFalse();

    assertThat(announcementRepository.findById(announcementId).orElseThrow().getDeletedAt())
        .isNotNull();
    assertThat(indexedIds(text)).doesNotContain(announcementId);
  }

  private Attachment storedCopy(UUID announcementId) {
    String path =
        storage
            .upload(
                new StorageUpload(
                    "it-" + announcementId, "공고문.pdf", new byte[] {1, 2, 3}, "application/pdf"))
            .filePath();
    return attachmentRepository.save(
        new AttachmentBuilder().id(null).announcementId(announcementId).storagePath(path).build());
  }

  private List<UUID> indexedIds(String text) {
    return hybridSearchService
        .hybridSearch(new HybridSearchRequest(text, null, 0.0, 10, 1.0))
        .stream()
        .map(HybridSearchResult::sourceId)
        .toList();
  }

  @Test
  void unknownAttachmentIsNotFound() {
    UUID missing = UUID.randomUUID();

    assertThatThrownBy(() -> catalogService.getAttachment(missing))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessageContaining(missing.toString());
  }
}
