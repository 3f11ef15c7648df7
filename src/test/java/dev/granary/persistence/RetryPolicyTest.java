package dev.granary.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;

class RetryPolicyTest {

  private final List<Long> sleeps = new ArrayList<>();

  private RetryPolicy policy(int maxRetries) {
    return new RetryPolicy(
        maxRetries, 10, 2.0, TransientErrorClassifier::isTransient, sleeps::add);
  }

  @Test
  void transientFailuresAreRetriedWithExponentialBackoff() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        policy(3)
            .execute(
                "save",
                () -> {
                  if (attempts.incrementAndGet() < 3) {
                    throw new TransientDataAccessResourceException("Connection is not available");
                  }
                  return "ok";
                });

    assertThat(result).isEqualTo("ok");
    assertThat(attempts).hasValue(3);
    assertThat(sleeps).containsExactly(10L, 20L);
  }

  @Test
  void exhaustedBudgetRethrowsTheOriginalException() {
    AtomicInteger attempts = new AtomicInteger();
    TransientDataAccessResourceException failure =
        new TransientDataAccessResourceException("pool exhausted");

    assertThatThrownBy(
            () ->
                policy(3)
                    .execute(
                        "save",
                        () -> {
                          attempts.incrementAndGet();
                          throw failure;
                        }))
        .isSameAs(failure);
    assertThat(attempts).hasValue(4);
    assertThat(sleeps).containsExactly(10L, 20L, 40L);
  }

  @Test
  void nonTransientFailuresAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy(3)
                    .run(
                        "insert",
                        () -> {
                          attempts.incrementAndGet();
                          throw new DataIntegrityViolationException("duplicate key");
                        }))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(attempts).hasValue(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void zeroRetriesMeansSingleAttempt() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy(0)
                    .execute(
                        "save",
                        () -> {
                          attempts.incrementAndGet();
                          throw new TransientDataAccessResourceException("timed out");
                        }))
        .isInstanceOf(TransientDataAccessResourceException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThatThrownBy(() -> new RetryPolicy(-1, 10, 2.0, e -> true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(1, 0, 2.0, e -> true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RetryPolicy(1, 10, 0.5, e -> true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void persistencePolicyUsesConfiguredBudget() {
    RetryPolicy persistence = RetryPolicy.forPersistence(new RetryProperties(3, 1000, 2.0));

    assertThat(persistence.maxRetries()).isEqualTo(3);
    assertThat(persistence.baseDelayMs()).isEqualTo(1000);
    assertThat(persistence.backoffFactor()).isEqualTo(2.0);
    assertThat(persistence.isRetryable(new TransientDataAccessResourceException("x"))).isTrue();
  }
}
