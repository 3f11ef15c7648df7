package dev.granary.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.granary.persistence.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.TransientDataAccessResourceException;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("NullAway.Init")
class DeduplicationRunnerTest {

  @Mock DeduplicationService deduplicationService;

  @Test
  void runsBatchesUntilOneProcessesNothing() {
    when(deduplicationService.groupBatch(20))
        .thenReturn(
            new GroupingResult(20, 3, 8), new GroupingResult(5, 1, 2), GroupingResult.EMPTY);
    DeduplicationRunner runner = runner(new DedupProperties(20, 0.2, 100), noRetry());

    GroupingResult total = runner.runUntilDrained();

    assertThat(total).isEqualTo(new GroupingResult(25, 4, 10));
    verify(deduplicationService, times(3)).groupBatch(20);
  }

  @Test
  void stopsAtIterationBoundWithBacklogLeft() {
    when(deduplicationService.groupBatch(10)).thenReturn(new GroupingResult(10, 0, 0));
    DeduplicationRunner runner = runner(new DedupProperties(10, 0.2, 3), noRetry());

    GroupingResult total = runner.runUntilDrained();

    assertThat(total.processed()).isEqualTo(30);
    verify(deduplicationService, times(3)).groupBatch(10);
  }

  @Test
  void transientBatchFailureIsRetried() {
    when(deduplicationService.groupBatch(50))
        .thenThrow(new TransientDataAccessResourceException("connection reset"))
        .thenReturn(new GroupingResult(4, 1, 2))
        .thenReturn(GroupingResult.EMPTY);
    RetryPolicy retryTransient =
        new RetryPolicy(2, 1, 1.0, e -> e instanceof TransientDataAccessResourceException);
    DeduplicationRunner runner = runner(new DedupProperties(0, 0, 0), retryTransient);

    GroupingResult total = runner.runUntilDrained();

    assertThat(total).isEqualTo(new GroupingResult(4, 1, 2));
    verify(deduplicationService, times(3)).groupBatch(50);
  }

  private DeduplicationRunner runner(DedupProperties properties, RetryPolicy retryPolicy) {
    return new DeduplicationRunner(deduplicationService, retryPolicy, properties);
  }

  private static RetryPolicy noRetry() {
    return new RetryPolicy(0, 1, 1.0, e -> false);
  }
}
