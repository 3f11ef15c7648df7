package dev.granary.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import dev.granary.BaseIntegrationTest;
import dev.granary.ingestion.IndexSourceType;
import dev.granary.ingestion.IndexingService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class HybridSearchIT extends BaseIntegrationTest {

  @Autowired HybridSearchService hybridSearchService;

  @Autowired IndexingService indexingService;

  static final UUID STARTUP_ID = UUID.randomUUID();
  static final String STARTUP_TEXT =
      "Youth startup academy recruits founders under 39 and provides seed funding, "
          + "office space and mentoring for early stage companies.";

  static final UUID EXPORT_FORM_ID = UUID.randomUUID();
  static final String EXPORT_FORM_TEXT =
      "Export voucher application form. Small manufacturers list target overseas markets, "
          + "planned trade shows and the export voucher amount requested.";

  static final UUID FACTORY_ID = UUID.randomUUID();
  static final String FACTORY_TEXT =
      "Smart factory construction subsidy covers automation equipment, MES software "
          + "and sensor installation for production lines.";

  @BeforeEach
  void seedTestData() {
    indexingService.replaceChunks(IndexSourceType.ANNOUNCEMENT, STARTUP_ID, STARTUP_TEXT);
    indexingService.replaceChunks(IndexSourceType.ATTACHMENT, EXPORT_FORM_ID, EXPORT_FORM_TEXT);
    indexingService.replaceChunks(IndexSourceType.ANNOUNCEMENT, FACTORY_ID, FACTORY_TEXT);
  }

  @Test
  void bestMatchRanksFirst() {
    List<HybridSearchResult> results =
        hybridSearchService.hybridSearch(
            new HybridSearchRequest("export voucher application", null, 0.3, 3, 0.7));

    assertThat(results).isNotEmpty();
    HybridSearchResult top = results.get(0);
    assertThat(top.sourceId()).isEqualTo(EXPORT_FORM_ID);
    assertThat(top.sourceType()).isEqualTo("attachment");
    assertThat(top.keywordScore()).isEqualTo(1.0);
    assertThat(results)
        .extracting(HybridSearchResult::combinedScore)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }

  @Test
  void typeFilterExcludesOtherRecords() {
    List<HybridSearchResult> results =
        hybridSearchService.hybridSearch(
            new HybridSearchRequest("export voucher application", "announcement", 0.0, 10, 0.7));

    assertThat(results)
        .isNotEmpty()
        .allSatisfy(r -> assertThat(r.sourceType()).isEqualTo("announcement"))
        .extracting(HybridSearchResult::sourceId)
        .doesNotContain(EXPORT_FORM_ID);
  }

  @Test
  void reindexingReplacesPreviousChunks() {
    indexingService.replaceChunks(
        IndexSourceType.ANNOUNCEMENT,
        FACTORY_ID,
        "Regional tourism festival sponsorship for local food vendors.");

    List<HybridSearchResult> results =
        hybridSearchService.hybridSearch(
            new HybridSearchRequest("smart factory automation", null, 0.0, 10, 0.7));

    assertThat(results)
        .filteredOn(r -> r.sourceId().equals(FACTORY_ID))
        .singleElement()
        .satisfies(r -> assertThat(r.content()).contains("tourism festival"));
  }

  @Test
  void deletedRecordIsNoLongerFound() {
    indexingService.deleteChunks(IndexSourceType.ATTACHMENT, EXPORT_FORM_ID);

    List<HybridSearchResult> results =
        hybridSearchService.hybridSearch(
            new HybridSearchRequest("export voucher application", null, 0.0, 10, 0.7));

    assertThat(results).extracting(HybridSearchResult::sourceId).doesNotContain(EXPORT_FORM_ID);
  }

  @Test
  void unknownTypeFilterIsRejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                hybridSearchService.hybridSearch(
                    new HybridSearchRequest("export", "brochure", 0.0, 10, 0.7)));
  }
}
