package dev.granary.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.granary.fixture.AnnouncementBuilder;
import dev.granary.fixture.AttachmentBuilder;
import dev.granary.persistence.RetryPolicy;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class CatalogServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

  @Mock AnnouncementRepository announcementRepository;

  @Mock AttachmentRepository attachmentRepository;

  @Mock TransactionTemplate transactionTemplate;

  @Mock ApplicationEventPublisher eventPublisher;

  @Captor ArgumentCaptor<List<Attachment>> savedAttachments;

  @Captor ArgumentCaptor<List<Attachment>> deletedAttachments;

  private CatalogService catalogService;

  @BeforeEach
  void setUp() {
    RetryPolicy noRetry = new RetryPolicy(0, 1, 1.0, e -> false);
    catalogService =
        new CatalogService(
            announcementRepository,
            attachmentRepository,
            noRetry,
            transactionTemplate,
            eventPublisher,
            CLOCK);
  }

  private void runTransactionsInline() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
  }

  private void assignIdOnSave(UUID id) {
    when(announcementRepository.save(any(Announcement.class)))
        .thenAnswer(
            inv -> {
              Announcement a = inv.getArgument(0);
              if (a.getId() == null) {
                ReflectionTestUtils.setField(a, "id", id);
              }
              return a;
            });
  }

  @Test
  void createsAnnouncementAndItsAttachments() {
    runTransactionsInline();
    UUID id = UUID.randomUUID();
    assignIdOnSave(id);
    AnnouncementDraft draft = new AnnouncementBuilder().draft();
    when(announcementRepository.findBySourceIdAndExternalId(draft.sourceId(), draft.externalId()))
        .thenReturn(Optional.empty());
    when(attachmentRepository.findByAnnouncementId(id)).thenReturn(List.of());

    UpsertOutcome outcome =
        catalogService.upsert(
            draft,
            List.of(
                new AttachmentBuilder().sourceUrl("https://x.kr/a.pdf").draft(),
                new AttachmentBuilder().sourceUrl("https://x.kr/b.hwp").draft()));

    assertThat(outcome.created()).isTrue();
    assertThat(outcome.announcementId()).isEqualTo(id);
    assertThat(outcome.attachmentsRecorded()).isEqualTo(2);
    verify(attachmentRepository).saveAll(savedAttachments.capture());
    assertThat(savedAttachments.getValue())
        .extracting(Attachment::getAnnouncementId)
        .containsOnly(id);
  }

  @Test
  void updatesExistingRowsInsteadOfDuplicating() {
    runTransactionsInline();
    Announcement existing = new AnnouncementBuilder().build();
    Attachment known =
        new AttachmentBuilder()
            .announcementId(existing.getId())
            .sourceUrl("https://x.kr/a.pdf")
            .storagePath("announcements/k/1_a.pdf")
            .build();
    AnnouncementDraft draft =
        new AnnouncementBuilder()
            .sourceId(existing.getSourceId())
            .externalId(existing.getExternalId())
            .name("2024년 청년창업 지원사업 수정공고")
            .draft();
    when(announcementRepository.findBySourceIdAndExternalId(any(), any()))
        .thenReturn(Optional.of(existing));
    when(announcementRepository.save(existing)).thenReturn(existing);
    when(attachmentRepository.findByAnnouncementId(existing.getId())).thenReturn(List.of(known));

    UpsertOutcome outcome =
        catalogService.upsert(
            draft,
            List.of(
                new AttachmentBuilder().sourceUrl("https://x.kr/a.pdf").storagePath(null).draft(),
                new AttachmentBuilder().sourceUrl("https://x.kr/a.pdf").draft(),
                new AttachmentBuilder().sourceUrl("https://x.kr/c.pdf").draft()));

    assertThat(outcome.created()).isFalse();
    assertThat(existing.getName()).isEqualTo("2024년 청년창업 지원사업 수정공고");
    assertThat(outcome.attachmentsRecorded()).isEqualTo(2);
    verify(attachmentRepository).saveAll(savedAttachments.capture());
    assertThat(savedAttachments.getValue()).hasSize(2).first().isSameAs(known);
    assertThat(known.getStoragePath()).isEqualTo("announcements/k/1_a.pdf");
  }

  @Test
  void extractedClassificationIsNormalizedBeforeSaving() {
    runTransactionsInline();
    assignIdOnSave(UUID.randomUUID());
    AnnouncementDraft base = new AnnouncementBuilder().name("부산 스타트업 육성 공고").draft();
    AnnouncementFields fields =
        new AnnouncementFields(
            null, null, null, null, null, null, null, "정책자금 융자", null, null, null, null, null,
            LocalDate.of(2024, 4, 1), null);
    AnnouncementDraft draft =
        new AnnouncementDraft(
            base.sourceId(),
            base.externalId(),
            base.name(),
            base.organization(),
            null,
            base.detailUrl(),
            base.contentHash(),
            base.normalizedName(),
            base.normalizedOrg(),
            fields);
    when(announcementRepository.findBySourceIdAndExternalId(any(), any()))
        .thenReturn(Optional.empty());

    catalogService.upsert(draft, List.of());

    ArgumentCaptor<Announcement> saved = ArgumentCaptor.forClass(Announcement.class);
    verify(announcementRepository).save(saved.capture());
    assertThat(saved.getValue().getCategory()).isEqualTo("자금");
    assertThat(saved.getValue().getRegion()).isEqualTo("부산");
    assertThat(saved.getValue().getStatus()).isEqualTo(AnnouncementStatus.ACTIVE);
    verify(attachmentRepository, never()).saveAll(any());
  }

  @Test
  void cleanupKeepsNewestAttachmentPerUrl() {
    runTransactionsInline();
    UUID announcementId = UUID.randomUUID();
    Attachment older =
        new AttachmentBuilder()
            .announcementId(announcementId)
            .sourceUrl("https://x.kr/a.pdf")
            .storagePath("announcements/k/1_a.pdf")
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    Attachment newer =
        new AttachmentBuilder()
            .announcementId(announcementId)
            .sourceUrl("https://x.kr/a.pdf")
            .createdAt(Instant.parse("2024-02-01T00:00:00Z"))
            .build();
    Attachment other =
        new AttachmentBuilder()
            .announcementId(announcementId)
            .sourceUrl("https://x.kr/b.pdf")
            .build();
    when(attachmentRepository.findByAnnouncementId(announcementId))
        .thenReturn(List.of(older, newer, other));

    int removed = catalogService.cleanupDuplicateAttachments(announcementId);

    assertThat(removed).isEqualTo(1);
    verify(attachmentRepository).deleteAll(deletedAttachments.capture());
    assertThat(deletedAttachments.getValue()).containsExactly(older);
    verify(eventPublisher)
        .publishEvent(
            new AttachmentRemovedEvent(older.getId(), announcementId, "announcements/k/1_a.pdf"));
  }

  @Test
  void secondCleanupRemovesNothing() {
    runTransactionsInline();
    UUID announcementId = UUID.randomUUID();
    Attachment older =
        new AttachmentBuilder()
            .announcementId(announcementId)
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    Attachment newer =
        new AttachmentBuilder()
            .announcementId(announcementId)
            .createdAt(Instant.parse("2024-02-01T00:00:00Z"))
            .build();
    when(attachmentRepository.findByAnnouncementId(announcementId))
        .thenReturn(List.of(older, newer))
        .thenReturn(List.of(newer));

    assertThat(catalogService.cleanupDuplicateAttachments(announcementId)).isEqualTo(1);
    assertThat(catalogService.cleanupDuplicateAttachments(announcementId)).isZero();
    verify(attachmentRepository, times(1)).deleteAll(any());
    verify(eventPublisher, times(1)).publishEvent(any(Object.class));
  }

  @Test
  void cleanupWithoutDuplicatesDeletesNothing() {
    runTransactionsInline();
    UUID announcementId = UUID.randomUUID();
    when(attachmentRepository.findByAnnouncementId(announcementId))
        .thenReturn(List.of(new AttachmentBuilder().announcementId(announcementId).build()));

    assertThat(catalogService.cleanupDuplicateAttachments(announcementId)).isZero();
    verify(attachmentRepository, never()).deleteAll(any());
  }

  @Test
  void deletingAGroupedAnnouncementRequeuesARemainingMember() {
    runTransactionsInline();
    UUID groupId = UUID.randomUUID();
    Announcement doomed = new AnnouncementBuilder().group(groupId, true).build();
    doomed.markDeduped(Instant.parse("2024-02-01T00:00:00Z"));
    Announcement sibling = new AnnouncementBuilder().group(groupId, false).build();
    sibling.markDeduped(Instant.parse("2024-02-01T00:00:00Z"));
    Attachment attachment = new AttachmentBuilder().announcementId(doomed.getId()).build();
    when(announcementRepository.findById(doomed.getId())).thenReturn(Optional.of(doomed));
    when(announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId))
        .thenReturn(List.of(sibling));
    when(attachmentRepository.findByAnnouncementId(doomed.getId()))
        .thenReturn(List.of(attachment));

    assertThat(catalogService.deleteAnnouncement(doomed.getId())).isTrue();

    assertThat(doomed.getDeletedAt()).isEqualTo(CLOCK.instant());
    assertThat(doomed.getGroupId()).isNull();
    assertThat(sibling.getDedupedAt()).isNull();
    verify(announcementRepository).save(sibling);
    verify(eventPublisher)
        .publishEvent(new AnnouncementRemovedEvent(doomed.getId(), List.of(attachment.getId())));
  }

  @Test
  void deletingTwiceIsANoOp() {
    runTransactionsInline();
    Announcement announcement = new AnnouncementBuilder().build();
    announcement.markDeleted(Instant.parse("2024-02-01T00:00:00Z"));
    when(announcementRepository.findById(announcement.getId()))
        .thenReturn(Optional.of(announcement));

    assertThat(catalogService.deleteAnnouncement(announcement.getId())).isFalse();
    verify(announcementRepository, never()).save(any());
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void deletingAnUnknownAnnouncementThrows() {
    runTransactionsInline();
    UUID id = UUID.randomUUID();
    when(announcementRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> catalogService.deleteAnnouncement(id))
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void missingAttachmentThrows() {
    UUID id = UUID.randomUUID();
    when(attachmentRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> catalogService.getAttachment(id))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessageContaining(id.toString());
  }
}
