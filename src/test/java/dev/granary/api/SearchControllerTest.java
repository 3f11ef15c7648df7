package dev.granary.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import dev.granary.search.HybridSearchRequest;
import dev.granary.search.HybridSearchResult;
import dev.granary.search.HybridSearchService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class SearchControllerTest {

  @Mock HybridSearchService hybridSearchService;
  @InjectMocks SearchController controller;

  @Test
  void queryParametersPassThroughToTheRequest() {
    HybridSearchRequest request = new HybridSearchRequest("청년 창업", "attachment", 0.5, 3, 0.6);
    HybridSearchResult hit =
        new HybridSearchResult(
            "emb-1", "attachment", UUID.randomUUID(), "청년 창업 지원", 0, 0.82, 1.0, 0.892);
    when(hybridSearchService.requestFor("청년 창업", "attachment", 0.5, 3, 0.6)).thenReturn(request);
    when(hybridSearchService.hybridSearch(request)).thenReturn(List.of(hit));

    List<HybridSearchResult> results =
        controller.search(new SearchQuery("청년 창업", "attachment", 0.5, 3, 0.6));

    assertThat(results).containsExactly(hit);
  }

  @Test
  void absentParametersAreLeftToDefaults() {
    HybridSearchRequest request = new HybridSearchRequest("수출바우처");
    when(hybridSearchService.requestFor("수출바우처", null, null, null, null)).thenReturn(request);
    when(hybridSearchService.hybridSearch(request)).thenReturn(List.of());

    assertThat(controller.search(new SearchQuery("수출바우처", null, null, null, null))).isEmpty();
  }
}
