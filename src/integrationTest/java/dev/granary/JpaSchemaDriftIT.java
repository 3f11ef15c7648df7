package dev.granary;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.AnalysisStatus;
import dev.granary.catalog.Attachment;
import dev.granary.catalog.AttachmentRepository;
import dev.granary.catalog.GroupReviewStatus;
import dev.granary.catalog.ProjectGroup;
import dev.granary.catalog.ProjectGroupRepository;
import dev.granary.crawl.CrawlJob;
import dev.granary.crawl.CrawlJobRepository;
import dev.granary.crawl.CrawlJobStats;
import dev.granary.crawl.CrawlJobStatus;
import dev.granary.fixture.AnnouncementBuilder;
import dev.granary.fixture.AttachmentBuilder;
import dev.granary.source.AdapterType;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=validate by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private SourceRepository sourceRepository;

    @Autowired
    private CrawlJobRepository crawlJobRepository;

    @Autowired
    private AnnouncementRepository announcementRepository;

    @Autowired
    private AttachmentRepository attachmentRepository;

    @Autowired
    private ProjectGroupRepository projectGroupRepository;

    @Test
    void sourceEntityRoundtripsAgainstFlywaySchema() {
        Source source = new Source(
                "https://www.gntp.or.kr/biz/apply?drift=" + UUID.randomUUID(), "경남테크노파크");
        source.setAdapterType(AdapterType.BROWSER);
        source.setWaitSelector("table");
        source.setDetailUrlTemplate("https://www.gntp.or.kr/biz/applyInfo/{id}");

        Source saved = sourceRepository.saveAndFlush(source);
        Source found = sourceRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getName()).isEqualTo("경남테크노파크");
        assertThat(found.getAdapterType()).isEqualTo(AdapterType.BROWSER);
        assertThat(found.getWaitSelector()).isEqualTo("table");
        assertThat(found.isActive()).isTrue();
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getUpdatedAt()).isNotNull();
    }

    @Test
    void crawlJobEntityRoundtripsAgainstFlywaySchema() {
        Source source = savedSource();
        CrawlJob job = new CrawlJob(source.getId());
        job.start(Instant.parse("2024-03-04T06:00:00Z"));
        job.complete(new CrawlJobStats(12, 3, 2, 7), Instant.parse("2024-03-04T06:05:00Z"));

        CrawlJob saved = crawlJobRepository.saveAndFlush(job);
        CrawlJob found = crawlJobRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getStatus()).isEqualTo(CrawlJobStatus.COMPLETED);
        assertThat(found.stats()).isEqualTo(new CrawlJobStats(12, 3, 2, 7));
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getCompletedAt()).isEqualTo(Instant.parse("2024-03-04T06:05:00Z"));
    }

    @Test
    void announcementAndAttachmentRoundtripAgainstFlywaySchema() {
        Source source = savedSource();
        Announcement announcement = new AnnouncementBuilder()
                .id(null)
                .createdAt(null)
                .sourceId(source.getId())
                .description("창업 7년 이내 기업 대상 사업화 자금 지원")
                .category("자금")
                .amountMax(100_000_000L)
                .deadline(LocalDate.of(2099, 12, 31))
                .build();

        Announcement saved = announcementRepository.saveAndFlush(announcement);
        Announcement found = announcementRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getExternalId()).isEqualTo(announcement.getExternalId());
        assertThat(found.getAmountMax()).isEqualTo(100_000_000L);
        assertThat(found.getDeadline()).isEqualTo(LocalDate.of(2099, 12, 31));
        assertThat(found.isEmbeddingStale()).isTrue();
        assertThat(found.getCreatedAt()).isNotNull();

        Attachment attachment = new AttachmentBuilder()
                .id(null)
                .createdAt(null)
                .announcementId(saved.getId())
                .storagePath("announcements/k/1700000000000_abcd1234.pdf")
                .analyzed("모집공고 본문")
                .build();
        Attachment savedAttachment = attachmentRepository.saveAndFlush(attachment);
        Attachment foundAttachment =
                attachmentRepository.findById(savedAttachment.getId()).orElseThrow();

        assertThat(foundAttachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZED);
        assertThat(foundAttachment.getParsedContent()).isEqualTo("모집공고 본문");
        assertThat(foundAttachment.isStored()).isTrue();
    }

    @Test
    void projectGroupEntityRoundtripsAgainstFlywaySchema() {
        ProjectGroup group = new ProjectGroup();
        group.flagForReview();
        UUID canonicalId = UUID.randomUUID();
        group.setCanonicalAnnouncementId(canonicalId);

        ProjectGroup saved = projectGroupRepository.saveAndFlush(group);
        ProjectGroup found = projectGroupRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getReviewStatus()).isEqualTo(GroupReviewStatus.PENDING_REVIEW);
        assertThat(found.getCanonicalAnnouncementId()).isEqualTo(canonicalId);
    }

    private Source savedSource() {
        return sourceRepository.saveAndFlush(
                new Source("https://drift.example.go.kr/" + UUID.randomUUID(), "drift"));
    }
}
