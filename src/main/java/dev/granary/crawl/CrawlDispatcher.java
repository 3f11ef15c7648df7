package dev.granary.crawl;

import dev.granary.dedup.DeduplicationRunner;
import dev.granary.fetch.SharedBrowser;
import dev.granary.persistence.RetryPolicy;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Starts crawl batches. One batch runs at a time; when every job of a batch has finished, the
 * shared browser is released and the dedup backlog is drained.
 */
@Component
public class CrawlDispatcher {

  private static final Logger log = LoggerFactory.getLogger(CrawlDispatcher.class);

  private final SourceRepository sourceRepository;
  private final CrawlJobRepository crawlJobRepository;
  private final CrawlJobRunner crawlJobRunner;
  private final SharedBrowser sharedBrowser;
  private final DeduplicationRunner deduplicationRunner;
  private final RetryPolicy retryPolicy;
  private final ThreadPoolTaskExecutor executor;
  private final AtomicBoolean batchRunning = new AtomicBoolean(false);

  public CrawlDispatcher(
      SourceRepository sourceRepository,
      CrawlJobRepository crawlJobRepository,
      CrawlJobRunner crawlJobRunner,
      SharedBrowser sharedBrowser,
      DeduplicationRunner deduplicationRunner,
      RetryPolicy retryPolicy,
      @Qualifier("crawlJobExecutor") ThreadPoolTaskExecutor executor) {
    this.sourceRepository = sourceRepository;
    this.crawlJobRepository = crawlJobRepository;
    this.crawlJobRunner = crawlJobRunner;
    this.sharedBrowser = sharedBrowser;
    this.deduplicationRunner = deduplicationRunner;
    this.retryPolicy = retryPolicy;
    this.executor = executor;
  }

  /**
   * Creates a pending job per active source and starts them on the crawl pool.
   *
   * @return ids of the created jobs, in source name order
   * @throws IllegalStateException if a batch is already running
   */
  public List<UUID> dispatchActiveSources() {
    claimBatch();
    try {
      List<Source> sources =
          retryPolicy.execute(
              "load active sources", sourceRepository::findAllByActiveTrueOrderByNameAsc);
      List<CrawlJob> jobs = new ArrayList<>(sources.size());
      for (Source source : sources) {
        jobs.add(
            retryPolicy.execute(
                "create crawl job", () -> crawlJobRepository.save(new CrawlJob(source.getId()))));
      }
      log.info("Dispatching {} crawl jobs", jobs.size());
      return submit(jobs);
    } catch (RuntimeException e) {
      batchRunning.set(false);
      throw e;
    }
  }

  /**
   * Runs up to five pending jobs, oldest first, as one batch. Does nothing while another batch is
   * running.
   *
   * @return ids of the started jobs
   */
  public List<UUID> runPendingJobs() {
    if (!batchRunning.compareAndSet(false, true)) {
      log.debug("Crawl batch in progress, pending jobs wait for the next poll");
      return List.of();
    }
    try {
      List<CrawlJob> pending =
          retryPolicy.execute(
              "load pending jobs",
              () -> crawlJobRepository.findTop5ByStatusOrderByCreatedAtAsc(CrawlJobStatus.PENDING));
      if (pending.isEmpty()) {
        batchRunning.set(false);
        return List.of();
      }
      log.info("Running {} pending crawl jobs", pending.size());
      return submit(pending);
    } catch (RuntimeException e) {
      batchRunning.set(false);
      throw e;
    }
  }

  public boolean isBatchRunning() {
    return batchRunning.get();
  }

  private void claimBatch() {
    if (!batchRunning.compareAndSet(false, true)) {
      throw new IllegalStateException("A crawl batch is already running");
    }
  }

  private List<UUID> submit(List<CrawlJob> jobs) {
    List<UUID> ids = new ArrayList<>(jobs.size());
    List<CompletableFuture<Void>> futures = new ArrayList<>(jobs.size());
    for (CrawlJob job : jobs) {
      UUID jobId = job.getId();
      ids.add(jobId);
      try {
        futures.add(CompletableFuture.runAsync(() -> runJob(jobId), executor));
      } catch (TaskRejectedException e) {
        log.warn("Crawl pool full, job {} stays pending: {}", jobId, e.getMessage());
      }
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .whenComplete((ignored, error) -> finishBatch());
    return ids;
  }

  private void runJob(UUID jobId) {
    try {
      crawlJobRunner.processCrawlJob(jobId);
    } catch (RuntimeException e) {
      log.error("Crawl job {} aborted: {}", jobId, e.getMessage(), e);
    }
  }

  /** Releases the shared browser, then drains the dedup backlog. */
  void finishBatch() {
    try {
      sharedBrowser.release();
    } finally {
      try {
        deduplicationRunner.runUntilDrained();
      } catch (RuntimeException e) {
        log.error("Deduplication after crawl batch failed: {}", e.getMessage(), e);
      } finally {
        batchRunning.set(false);
      }
    }
  }
}
