package dev.granary.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import dev.granary.BaseIntegrationTest;
import dev.granary.catalog.Announcement;
import dev.granary.catalog.AnnouncementRepository;
import dev.granary.catalog.CatalogService;
import dev.granary.catalog.GroupReviewStatus;
import dev.granary.catalog.ProjectGroup;
import dev.granary.catalog.ProjectGroupRepository;
import dev.granary.fixture.AnnouncementBuilder;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class DeduplicationIT extends BaseIntegrationTest {

  @Autowired DeduplicationRunner deduplicationRunner;
  @Autowired CatalogService catalogService;
  @Autowired SourceRepository sourceRepository;
  @Autowired AnnouncementRepository announcementRepository;
  @Autowired ProjectGroupRepository projectGroupRepository;

  private Source bizinfo;
  private Source kstartup;
  private String organization;

  @BeforeEach
  void createSources() {
    bizinfo = source("기업마당");
    kstartup = source("K-Startup");
    // letters only, so the organization fingerprint is unique to this test
    organization = "Agency " + UUID.randomUUID().toString().replaceAll("[^a-f]", "");
  }

  @Test
  void crossPostedAnnouncementsShareOneGroup() {
    UUID early =
        upsert(bizinfo, "2024년 청년창업사관학교 제2차 모집 공고", LocalDate.of(2099, 3, 31));
    UUID late = upsert(kstartup, "[2024] 청년창업사관학교 모집공고", LocalDate.of(2099, 4, 30));

    deduplicationRunner.runUntilDrained();

    Announcement first = announcementRepository.findById(early).orElseThrow();
    Announcement second = announcementRepository.findById(late).orElseThrow();
    assertThat(first.getGroupId()).isNotNull().isEqualTo(second.getGroupId());
    assertThat(first.getNormalizedName()).isEqualTo("2024:청년창업사관학교");
    assertThat(second.isCanonical()).isTrue();
    assertThat(first.isCanonical()).isFalse();
    assertThat(first.getDedupedAt()).isNotNull();

    ProjectGroup group = projectGroupRepository.findById(first.getGroupId()).orElseThrow();
    assertThat(group.getCanonicalAnnouncementId()).isEqualTo(late);
    assertThat(group.getReviewStatus()).isEqualTo(GroupReviewStatus.AUTO_GROUPED);
  }

  @Test
  void laterCrossPostJoinsExistingGroup() {
    UUID first = upsert(bizinfo, "2024년 수출바우처 참여기업 모집", LocalDate.of(2099, 5, 1));
    UUID second = upsert(kstartup, "2024 수출바우처 참여기업 모집 공고", LocalDate.of(2099, 5, 1));
    deduplicationRunner.runUntilDrained();
    UUID groupId = announcementRepository.findById(first).orElseThrow().getGroupId();

    Source thirdPortal = source("경남테크노파크");
    UUID third = upsert(thirdPortal, "(공고) 2024년도 수출바우처 참여기업 모집", null);
    deduplicationRunner.runUntilDrained();

    List<Announcement> members = announcementRepository.findByGroupIdAndDeletedAtIsNull(groupId);
    assertThat(members).extracting(Announcement::getId).contains(first, second, third);
    assertThat(members).filteredOn(Announcement::isCanonical).hasSize(1);
    assertThat(announcementRepository.findById(third).orElseThrow().isCanonical()).isFalse();
  }

  @Test
  void uniqueAnnouncementStaysUngrouped() {
    UUID lonely = upsert(bizinfo, "2024년 스마트공장 구축 지원사업 안내", LocalDate.of(2099, 6, 1));

    deduplicationRunner.runUntilDrained();

    Announcement announcement = announcementRepository.findById(lonely).orElseThrow();
    assertThat(announcement.getGroupId()).isNull();
    assertThat(announcement.isCanonical()).isTrue();
    assertThat(announcement.getDedupedAt()).isNotNull();
  }

  private UUID upsert(Source source, String name, @Nullable LocalDate deadline) {
    AnnouncementBuilder builder =
        new AnnouncementBuilder()
            .sourceId(source.getId())
            .externalId("ext-" + UUID.randomUUID())
            .name(name)
            .organization(organization)
            .deadline(deadline);
    return catalogService.upsert(builder.draft(), List.of()).announcementId();
  }

  private Source source(String name) {
    return sourceRepository.save(
        new Source("https://dedup.example.go.kr/" + UUID.randomUUID(), name));
  }
}
