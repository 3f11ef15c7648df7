package dev.granary.persistence;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Reusable retry-with-backoff policy applied to persistence call sites.
 *
 * <p>Only failures accepted by {@code isRetryable} are retried; the k-th retry waits {@code
 * baseDelay * backoffFactor^k} milliseconds. When the budget is exhausted, or the failure is not
 * retryable, the original exception is rethrown unmodified.
 */
public final class RetryPolicy {

  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  private final int maxRetries;
  private final long baseDelayMs;
  private final double backoffFactor;
  private final Predicate<Throwable> isRetryable;
  private final RetryTemplate template;

  /**
   * Creates a policy that sleeps on the calling thread between attempts.
   *
   * @param maxRetries retries after the first attempt, at least 0
   * @param baseDelayMs delay before the first retry, at least 1
   * @param backoffFactor delay multiplier, at least 1.0
   * @param isRetryable decides which failures are retried
   */
  public RetryPolicy(
      int maxRetries, long baseDelayMs, double backoffFactor, Predicate<Throwable> isRetryable) {
    this(maxRetries, baseDelayMs, backoffFactor, isRetryable, new ThreadWaitSleeper());
  }

  RetryPolicy(
      int maxRetries,
      long baseDelayMs,
      double backoffFactor,
      Predicate<Throwable> isRetryable,
      Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative, got: " + maxRetries);
    }
    if (baseDelayMs < 1) {
      throw new IllegalArgumentException("baseDelayMs must be at least 1, got: " + baseDelayMs);
    }
    if (backoffFactor < 1.0) {
      throw new IllegalArgumentException("backoffFactor must be >= 1.0, got: " + backoffFactor);
    }
    this.maxRetries = maxRetries;
    this.baseDelayMs = baseDelayMs;
    this.backoffFactor = backoffFactor;
    this.isRetryable = Objects.requireNonNull(isRetryable, "isRetryable must not be null");
    this.template = buildTemplate(sleeper);
  }

  /**
   * Policy for database calls: transient classification by {@link TransientErrorClassifier}.
   *
   * @param properties retry budget
   * @return a persistence retry policy
   */
  public static RetryPolicy forPersistence(RetryProperties properties) {
    return new RetryPolicy(
        properties.maxRetries(),
        properties.baseDelayMs(),
        properties.backoffFactor(),
        TransientErrorClassifier::isTransient);
  }

  /**
   * Runs the action, retrying retryable failures.
   *
   * @param operation short label used in log lines
   * @param action the call to run
   * @return the action's result
   */
  public <T> T execute(String operation, Supplier<T> action) {
    return template.execute(
        (RetryCallback<T, RuntimeException>)
            context -> {
              if (context.getRetryCount() > 0) {
                log.debug("Retrying {} (attempt {})", operation, context.getRetryCount() + 1);
              }
              return action.get();
            });
  }

  /**
   * Runs an action without a result, retrying retryable failures.
   *
   * @param operation short label used in log lines
   * @param action the call to run
   */
  public void run(String operation, Runnable action) {
    execute(
        operation,
        () -> {
          action.run();
          return null;
        });
  }

  public int maxRetries() {
    return maxRetries;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public double backoffFactor() {
    return backoffFactor;
  }

  public boolean isRetryable(Throwable error) {
    return isRetryable.test(error);
  }

  private RetryTemplate buildTemplate(Sleeper sleeper) {
    // Both delegates are created once: the classifier policy keeps per-delegate attempt counts.
    SimpleRetryPolicy transientPolicy = new SimpleRetryPolicy(maxRetries + 1);
    NeverRetryPolicy neverRetry = new NeverRetryPolicy();
    ExceptionClassifierRetryPolicy retryPolicy = new ExceptionClassifierRetryPolicy();
    retryPolicy.setExceptionClassifier(
        error -> isRetryable.test(error) ? transientPolicy : neverRetry);

    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(baseDelayMs);
    backOff.setMultiplier(backoffFactor);
    backOff.setMaxInterval(Long.MAX_VALUE);
    backOff.setSleeper(sleeper);

    RetryTemplate retryTemplate = new RetryTemplate();
    retryTemplate.setRetryPolicy(retryPolicy);
    retryTemplate.setBackOffPolicy(backOff);
    retryTemplate.registerListener(
        new RetryListener() {
          @Override
          public <T, E extends Throwable> void onError(
              RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            if (isRetryable.test(throwable) && context.getRetryCount() <= maxRetries) {
              log.warn(
                  "Transient persistence failure (attempt {} of {}): {}",
                  context.getRetryCount(),
                  maxRetries + 1,
                  throwable.getMessage());
            }
          }
        });
    return retryTemplate;
  }
}
