package dev.granary.api;

import dev.granary.crawl.CrawlDispatcher;
import dev.granary.crawl.CrawlJobRunner;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Crawl triggers.
 *
 * <ul>
 *   <li>{@code POST /api/crawl/dispatch} - one job per active source, 202 with the job ids, 409
 *       while a batch runs
 *   <li>{@code POST /api/crawl/jobs/{id}/run} - runs one pending job synchronously
 *   <li>{@code GET /api/crawl/jobs/{id}} - job status and counters
 * </ul>
 */
@RestController
@RequestMapping("/api/crawl")
public class CrawlController {

  private final CrawlDispatcher crawlDispatcher;
  private final CrawlJobRunner crawlJobRunner;

  public CrawlController(CrawlDispatcher crawlDispatcher, CrawlJobRunner crawlJobRunner) {
    this.crawlDispatcher = crawlDispatcher;
    this.crawlJobRunner = crawlJobRunner;
  }

  @PostMapping("/dispatch")
  public ResponseEntity<Map<String, List<UUID>>> dispatch() {
    List<UUID> jobIds = crawlDispatcher.dispatchActiveSources();
    return ResponseEntity.accepted().body(Map.of("jobIds", jobIds));
  }

  @PostMapping("/jobs/{id}/run")
  public CrawlJobView run(@PathVariable UUID id) {
    crawlJobRunner.processCrawlJob(id);
    return CrawlJobView.from(crawlJobRunner.getJob(id));
  }

  @GetMapping("/jobs/{id}")
  public CrawlJobView get(@PathVariable UUID id) {
    return CrawlJobView.from(crawlJobRunner.getJob(id));
  }
}
