package dev.granary.crawl;

import dev.granary.catalog.UpsertOutcome;
import dev.granary.detail.DetailFetchException;
import dev.granary.fetch.FetchAdapter;
import dev.granary.fetch.FetchException;
import dev.granary.fetch.FetchOptions;
import dev.granary.fetch.FetchedPage;
import dev.granary.listing.ListingCandidate;
import dev.granary.listing.ListingContext;
import dev.granary.listing.ListingExtractor;
import dev.granary.persistence.PersistenceFailureException;
import dev.granary.persistence.RetryPolicy;
import dev.granary.source.AdapterType;
import dev.granary.source.Source;
import dev.granary.source.SourceRepository;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs one crawl job: listing fetch and extraction, then each candidate through the
 * {@link AnnouncementPipeline}.
 *
 * <p>The job fails only when the listing cannot be fetched or extracted. After that, every item is
 * isolated: fetch and detail errors are logged as warnings, persistence errors are classified and
 * logged as errors, and the job completes with whatever the remaining items produced.
 */
@Service
public class CrawlJobRunner {

  private static final Logger log = LoggerFactory.getLogger(CrawlJobRunner.class);

  private final CrawlJobRepository crawlJobRepository;
  private final SourceRepository sourceRepository;
  private final FetchAdapter fetchAdapter;
  private final ListingExtractor listingExtractor;
  private final AnnouncementPipeline announcementPipeline;
  private final RetryPolicy retryPolicy;
  private final CrawlProperties properties;
  private final Clock clock;

  public CrawlJobRunner(
      CrawlJobRepository crawlJobRepository,
      SourceRepository sourceRepository,
      FetchAdapter fetchAdapter,
      ListingExtractor listingExtractor,
      AnnouncementPipeline announcementPipeline,
      RetryPolicy retryPolicy,
      CrawlProperties properties,
      Clock clock) {
    this.crawlJobRepository = crawlJobRepository;
    this.sourceRepository = sourceRepository;
    this.fetchAdapter = fetchAdapter;
    this.listingExtractor = listingExtractor;
    this.announcementPipeline = announcementPipeline;
    this.retryPolicy = retryPolicy;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Processes a pending crawl job.
   *
   * @param jobId the job to run
   * @return the job's counters; all zero when the job failed
   * @throws NoSuchElementException if the job or its source does not exist
   * @throws IllegalStateException if the job is not pending
   */
  public CrawlJobStats processCrawlJob(UUID jobId) {
    CrawlJob job = getJob(jobId);
    Source source =
        retryPolicy
            .execute("load source", () -> sourceRepository.findById(job.getSourceId()))
            .orElseThrow(
                () -> new NoSuchElementException("Source not found: " + job.getSourceId()));

    job.start(clock.instant());
    save(job);
    log.info("Starting crawl job {} for {} ({})", jobId, source.getName(), source.getUrl());

    List<ListingCandidate> candidates;
    try {
      candidates = fetchListing(source);
    } catch (RuntimeException e) {
      log.error("Crawl job {} failed on listing {}: {}", jobId, source.getUrl(), e.getMessage());
      job.fail(e.getMessage(), clock.instant());
      save(job);
      return CrawlJobStats.EMPTY;
    }

    CrawlJobStats stats = processCandidates(source, candidates);

    source.setLastCrawledAt(clock.instant());
    retryPolicy.run("stamp source", () -> sourceRepository.save(source));
    job.complete(stats, clock.instant());
    save(job);
    log.info(
        "Crawl job {} completed: {} found, {} new, {} updated, {} files",
        jobId,
        stats.projectsFound(),
        stats.projectsNew(),
        stats.projectsUpdated(),
        stats.filesProcessed());
    return stats;
  }

  /**
   * Loads a job.
   *
   * @throws NoSuchElementException if no job has the id
   */
  public CrawlJob getJob(UUID jobId) {
    return retryPolicy
        .execute("load crawl job", () -> crawlJobRepository.findById(jobId))
        .orElseThrow(() -> new NoSuchElementException("Crawl job not found: " + jobId));
  }

  private List<ListingCandidate> fetchListing(Source source) {
    FetchOptions options =
        source.getAdapterType() == AdapterType.BROWSER
            ? FetchOptions.browser(source.getWaitSelector())
            : FetchOptions.defaults();
    FetchedPage page = fetchAdapter.fetch(source.getUrl(), options);
    List<ListingCandidate> candidates =
        listingExtractor.extractListings(
            page.html(), new ListingContext(page.finalUrl(), source.getDetailUrlTemplate()));
    log.info("Listing {} yielded {} candidates", source.getUrl(), candidates.size());
    return candidates;
  }

  private CrawlJobStats processCandidates(Source source, List<ListingCandidate> candidates) {
    int found = 0;
    int created = 0;
    int updated = 0;
    int files = 0;
    for (ListingCandidate candidate : candidates) {
      if (!candidate.isValid()) {
        continue;
      }
      if (found > 0 && !pause()) {
        log.warn("Crawl of {} interrupted after {} items", source.getName(), found);
        break;
      }
      found++;
      try {
        UpsertOutcome outcome = announcementPipeline.process(source, candidate);
        if (outcome.created()) {
          created++;
        } else {
          updated++;
        }
        files += outcome.attachmentsRecorded();
      } catch (DetailFetchException e) {
        log.warn("Skipping {}: detail fetch failed ({})", e.getUrl(), e.getKind());
      } catch (FetchException e) {
        log.warn("Skipping {}: fetch failed ({})", candidate.detailLink(), e.getKind());
      } catch (DataAccessException | PersistenceFailureException e) {
        PersistenceFailureException failure =
            e instanceof PersistenceFailureException p
                ? p
                : PersistenceFailureException.classify("upsert " + candidate.detailLink(), e);
        log.error("Skipping {}: {}", candidate.detailLink(), failure.getMessage(), failure);
      } catch (RuntimeException e) {
        log.error("Skipping {}: {}", candidate.detailLink(), e.getMessage(), e);
      }
    }
    return new CrawlJobStats(found, created, updated, files);
  }

  /** Sleeps for the politeness delay; false when interrupted. */
  private boolean pause() {
    if (properties.detailDelayMs() == 0) {
      return true;
    }
    try {
      Thread.sleep(properties.detailDelayMs());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void save(CrawlJob job) {
    retryPolicy.run("save crawl job", () -> crawlJobRepository.save(job));
  }
}
