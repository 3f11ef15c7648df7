package dev.granary.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} behind crawl job and dedup timestamps, soft deletes, the
 * open/closed status derived from announcement deadlines, and the expiry of signed download URLs.
 * Deadlines are Korean calendar dates, so the clock runs in {@code Asia/Seoul}.
 */
@Configuration
public class ClockConfig {

  static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.system(SEOUL);
  }
}
