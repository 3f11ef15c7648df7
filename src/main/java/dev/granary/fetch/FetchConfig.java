package dev.granary.fetch;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used for plain page fetches and attachment downloads.
 *
 * <p>Timeouts come from {@code granary.fetch.*}; every request carries the desktop user agent and
 * a Korean {@code Accept-Language}.
 */
@Configuration
public class FetchConfig {

  /**
   * Creates the REST client qualified as {@code "fetchRestClient"}.
   *
   * @param builder Spring-provided builder with common defaults
   * @param userAgent desktop browser user agent
   * @param connectTimeoutMs TCP connection timeout in milliseconds
   * @param readTimeoutMs response read timeout in milliseconds
   * @return a REST client for origin servers
   */
  @Bean
  public RestClient fetchRestClient(
      RestClient.Builder builder,
      @Value("${granary.fetch.user-agent}") String userAgent,
      @Value("${granary.fetch.connect-timeout-ms}") int connectTimeoutMs,
      @Value("${granary.fetch.read-timeout-ms}") int readTimeoutMs) {

    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
    requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

    return builder
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
        .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7")
        .defaultHeader(
            HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
        .build();
  }
}
