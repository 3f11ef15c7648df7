package dev.granary.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.granary.analysis.AnalysisOrchestrator;
import dev.granary.catalog.AnnouncementDraft;
import dev.granary.catalog.CatalogService;
import dev.granary.catalog.UpsertOutcome;
import dev.granary.detail.AttachmentProperties;
import dev.granary.detail.DetailResolver;
import dev.granary.detail.SelectiveStoragePolicy;
import dev.granary.fetch.FetchAdapter;
import dev.granary.fetch.FetchException;
import dev.granary.fetch.FetchOptions;
import dev.granary.fetch.FetchedPage;
import dev.granary.fixture.SourceBuilder;
import dev.granary.listing.ListingExtractor;
import dev.granary.persistence.RetryPolicy;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * One crawl job through the real listing extractor, detail resolver and pipeline; only the network
 * and the catalog are mocked.
 */
@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class CrawlJobFlowTest {

  private static final Instant NOW = Instant.parse("2024-03-01T06:00:00Z");
  private static final String LISTING_URL = "https://www.bizinfo.go.kr/web/list.do";
  private static final String HEALTHY_LINK = "https://www.bizinfo.go.kr/web/view.do?id=1002";
  private static final String SLOW_LINK = "https://www.bizinfo.go.kr/web/view.do?id=1003";

  private static final String LISTING_HTML =
      """
      <html><body>
      <table class="board">
        <thead><tr><th>번호</th><th>제목</th><th>기관</th><th>등록일</th></tr></thead>
        <tbody>
          <tr class="notice"><td>공지</td><td><a href="/web/view.do?id=1">개인정보 처리방침 개정 안내</a></td>
            <td>관리자</td><td>2024-01-02</td></tr>
          <tr><td>2</td><td><a href="/web/view.do?id=1002">2024년 수출바우처 참여기업 모집 공고</a></td>
            <td>산업통상자원부</td><td>2024-02-27</td></tr>
          <tr><td>1</td><td><a href="/web/view.do?id=1003">2024년 스마트공장 구축 지원사업 공고</a></td>
            <td>중소벤처기업부</td><td>2024-02-26</td></tr>
        </tbody>
      </table>
      </body></html>
      """;

  private static final String DETAIL_HTML =
      """
      <html><body><div class="view">
      수출바우처 참여기업을 다음과 같이 모집합니다. 신청기간 2024.03.04 ~ 2024.03.29
      </div></body></html>
      """;

  @Mock CrawlJobRepository crawlJobRepository;
  @Mock SourceRepository sourceRepository;
  @Mock FetchAdapter fetchAdapter;
  @Mock AttachmentIntake attachmentIntake;
  @Mock AnalysisOrchestrator analysisOrchestrator;
  @Mock CatalogService catalogService;

  @Captor ArgumentCaptor<AnnouncementDraft> draftCaptor;

  private CrawlJobRunner runner;
  private Source source;
  private CrawlJob job;

  @BeforeEach
  void setUp() {
    AnnouncementPipeline pipeline =
        new AnnouncementPipeline(
            new DetailResolver(
                fetchAdapter, new SelectiveStoragePolicy(new AttachmentProperties(50_000_000))),
            fetchAdapter,
            attachmentIntake,
            analysisOrchestrator,
            catalogService);
    runner =
        new CrawlJobRunner(
            crawlJobRepository,
            sourceRepository,
            fetchAdapter,
            new ListingExtractor(),
            pipeline,
            new RetryPolicy(0, 1, 1.0, e -> false),
            new CrawlProperties(0, null, 0, 0, 0),
            Clock.fixed(NOW, ZoneOffset.UTC));
    source = new SourceBuilder().url(LISTING_URL).name("기업마당").build();
    job = new CrawlJob(source.getId());
  }

  @Test
  void pinnedNoticeIsSkippedAndTimedOutDetailIsLeftOut() {
    UUID jobId = UUID.randomUUID();
    when(crawlJobRepository.findById(jobId)).thenReturn(Optional.of(job));
    when(sourceRepository.findById(source.getId())).thenReturn(Optional.of(source));
    when(fetchAdapter.fetch(anyString(), any(FetchOptions.class)))
        .thenAnswer(inv -> respond(inv.getArgument(0)));
    when(catalogService.findAnnouncement(eq(source.getId()), anyString()))
        .thenReturn(Optional.empty());
    when(attachmentIntake.process(
            eq(List.of()), anyString(), anyString(), eq(false), eq(Map.of())))
        .thenReturn(List.of());
    when(analysisOrchestrator.analyzeAnnouncement(anyString())).thenReturn(null);
    when(catalogService.upsert(any(), eq(List.of())))
        .thenReturn(new UpsertOutcome(UUID.randomUUID(), true, 0, 0));

    CrawlJobStats stats = runner.processCrawlJob(jobId);

    assertThat(stats).isEqualTo(new CrawlJobStats(2, 1, 0, 0));
    assertThat(job.getStatus()).isEqualTo(CrawlJobStatus.COMPLETED);
    assertThat(job.stats()).isEqualTo(stats);
    verify(catalogService, times(1)).upsert(draftCaptor.capture(), eq(List.of()));
    AnnouncementDraft stored = draftCaptor.getValue();
    assertThat(stored.detailUrl()).isEqualTo(UrlNormalizer.normalize(HEALTHY_LINK));
    assertThat(stored.name()).isEqualTo("2024년 수출바우처 참여기업 모집 공고");
    assertThat(stored.organization()).isEqualTo("산업통상자원부");
    // listing, healthy detail, timed-out detail; the pinned row is never fetched
    verify(fetchAdapter, times(3)).fetch(anyString(), any(FetchOptions.class));
  }

  private static FetchedPage respond(String url) {
    if (url.equals(LISTING_URL)) {
      return new FetchedPage(LISTING_HTML, LISTING_URL);
    }
    if (url.equals(UrlNormalizer.normalize(HEALTHY_LINK))) {
      return new FetchedPage(DETAIL_HTML, url);
    }
    if (url.equals(UrlNormalizer.normalize(SLOW_LINK))) {
      throw new FetchException(FetchException.Kind.TIMEOUT, url, "read timed out");
    }
    throw new IllegalStateException("unexpected fetch of " + url);
  }
}
