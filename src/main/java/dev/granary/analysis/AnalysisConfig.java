package dev.granary.analysis;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Wires the analysis sidecar client and the bounded reanalysis worker pool.
 *
 * <p>Timeouts and pool sizes are externalized via {@code granary.analysis.*}.
 */
@Configuration
public class AnalysisConfig {

  /**
   * Creates the {@link RestClient} targeting the analysis sidecar.
   *
   * @param builder Spring-provided builder with common defaults
   * @param baseUrl sidecar base URL (e.g. {@code http://localhost:8090})
   * @param connectTimeoutMs TCP connection timeout in milliseconds
   * @param readTimeoutMs response read timeout in milliseconds
   * @return a named REST client bean for injection into {@link AnalysisClient}
   */
  @Bean
  public RestClient analysisRestClient(
      RestClient.Builder builder,
      @Value("${granary.analysis.base-url}") String baseUrl,
      @Value("${granary.analysis.connect-timeout-ms}") int connectTimeoutMs,
      @Value("${granary.analysis.read-timeout-ms}") int readTimeoutMs) {

    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
    requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

    return builder
        .baseUrl(baseUrl)
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  /** Fixed-size pool with a bounded queue; a full queue rejects new work. */
  @Bean
  public ThreadPoolTaskExecutor analysisExecutor(AnalysisProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("analysis-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
