package dev.granary.persistence;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the shared persistence {@link RetryPolicy}. */
@Configuration
public class PersistenceRetryConfig {

  @Bean
  public RetryPolicy persistenceRetryPolicy(RetryProperties properties) {
    return RetryPolicy.forPersistence(properties);
  }
}
