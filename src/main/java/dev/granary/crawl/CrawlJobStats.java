package dev.granary.crawl;

/**
 * Counters reported by one crawl job.
 *
 * @param projectsFound valid listing candidates
 * @param projectsNew announcements created
 * @param projectsUpdated existing announcements refreshed
 * @param filesProcessed attachments recorded
 */
public record CrawlJobStats(
    int projectsFound, int projectsNew, int projectsUpdated, int filesProcessed) {

  public static final CrawlJobStats EMPTY = new CrawlJobStats(0, 0, 0, 0);
}
