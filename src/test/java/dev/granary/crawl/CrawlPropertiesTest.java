package dev.granary.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.Test;

class CrawlPropertiesTest {

  @Test
  void missingValuesFallBackToDefaults() {
    CrawlProperties properties = new CrawlProperties(0, " ", 0, 0, 0);

    assertThat(properties.cron()).isEqualTo("0 0 6 * * *");
    assertThat(properties.pendingPollMs()).isEqualTo(60_000);
    assertThat(properties.workerThreads()).isEqualTo(2);
    assertThat(properties.queueCapacity()).isEqualTo(100);
  }

  @Test
  void negativeDetailDelayIsRejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> new CrawlProperties(-1, null, 0, 0, 0))
        .withMessageContaining("detail-delay-ms");
  }

  @Test
  void crawlPoolFollowsProperties() {
    var executor = new CrawlConfig().crawlJobExecutor(new CrawlProperties(500, null, 0, 3, 7));

    assertThat(executor.getCorePoolSize()).isEqualTo(3);
    assertThat(executor.getMaxPoolSize()).isEqualTo(3);
    assertThat(executor.getQueueCapacity()).isEqualTo(7);
    assertThat(executor.getThreadNamePrefix()).isEqualTo("crawl-");
  }
}
