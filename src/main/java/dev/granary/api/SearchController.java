package dev.granary.api;

import dev.granary.search.HybridSearchResult;
import dev.granary.search.HybridSearchService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Hybrid search over announcement and attachment chunks. */
@RestController
@RequestMapping("/api/search")
public class SearchController {

  private final HybridSearchService hybridSearchService;

  public SearchController(HybridSearchService hybridSearchService) {
    this.hybridSearchService = hybridSearchService;
  }

  @PostMapping
  public List<HybridSearchResult> search(@Valid @RequestBody SearchQuery query) {
    return hybridSearchService.hybridSearch(
        hybridSearchService.requestFor(
            query.queryText(),
            query.sourceType(),
            query.matchThreshold(),
            query.matchCount(),
            query.semanticWeight()));
  }
}
