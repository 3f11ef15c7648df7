package dev.granary.crawl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Triggers the daily crawl batch and picks up jobs created by external triggers. */
@Component
public class CrawlScheduler {

  private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

  private final CrawlDispatcher crawlDispatcher;

  public CrawlScheduler(CrawlDispatcher crawlDispatcher) {
    this.crawlDispatcher = crawlDispatcher;
  }

  @Scheduled(cron = "${granary.crawl.cron}", zone = "Asia/Seoul")
  public void dailyBatch() {
    if (crawlDispatcher.isBatchRunning()) {
      log.warn("Skipping scheduled crawl: previous batch still running");
      return;
    }
    try {
      crawlDispatcher.dispatchActiveSources();
    } catch (IllegalStateException e) {
      log.warn("Skipping scheduled crawl: {}", e.getMessage());
    }
  }

  @Scheduled(
      fixedDelayString = "${granary.crawl.pending-poll-ms}",
      initialDelayString = "${granary.crawl.pending-poll-ms}")
  public void pollPendingJobs() {
    crawlDispatcher.runPendingJobs();
  }
}
