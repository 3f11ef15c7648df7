package dev.granary.analysis;

import dev.granary.catalog.AnnouncementFields;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client for the document analysis sidecar.
 *
 * <p>{@code POST /analyze} reads one document; {@code POST /extract-fields} turns announcement text
 * into {@link AnnouncementFields}. Both retry on {@link RestClientException} with exponential
 * backoff and degrade to a failure result (or null fields) once retries are exhausted.
 */
@Service
public class AnalysisClient implements DocumentAnalyzer, AnnouncementFieldExtractor {

  private static final Logger log = LoggerFactory.getLogger(AnalysisClient.class);

  private final RestClient restClient;

  public AnalysisClient(@Qualifier("analysisRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${granary.analysis.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${granary.analysis.retry.delay-ms}",
              multiplierExpression = "${granary.analysis.retry.multiplier}"),
      recover = "recoverAnalyze")
  public AnalysisResult analyze(AnalysisRequest request) {
    AnalysisResult result =
        restClient.post().uri("/analyze").body(request).retrieve().body(AnalysisResult.class);
    if (result == null) {
      return AnalysisResult.failure("Analyzer returned an empty response");
    }
    return result;
  }

  @Recover
  AnalysisResult recoverAnalyze(RestClientException e, AnalysisRequest request) {
    log.warn(
        "Document analysis failed after retries ({}, {}): {}",
        request.documentType(),
        request.mimeType(),
        e.getMessage());
    return AnalysisResult.failure(e.getMessage());
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${granary.analysis.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${granary.analysis.retry.delay-ms}",
              multiplierExpression = "${granary.analysis.retry.multiplier}"),
      recover = "recoverExtract")
  public @Nullable AnnouncementFields extract(String text) {
    return restClient
        .post()
        .uri("/extract-fields")
        .body(Map.of("text", text))
        .retrieve()
        .body(AnnouncementFields.class);
  }

  @Recover
  @Nullable
  AnnouncementFields recoverExtract(RestClientException e, String text) {
    log.warn("Field extraction failed after retries ({} chars): {}", text.length(), e.getMessage());
    return null;
  }
}
