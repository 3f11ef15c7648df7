package dev.granary.crawl;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CrawlJob} entities. */
public interface CrawlJobRepository extends JpaRepository<CrawlJob, UUID> {

  /** Oldest pending jobs first, at most five. */
  List<CrawlJob> findTop5ByStatusOrderByCreatedAtAsc(CrawlJobStatus status);
}
