package dev.granary.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/** Bounded queue of reanalysis work, backed by the {@code analysisExecutor} pool. */
@Component
public class AnalysisTaskQueue {

  private static final Logger log = LoggerFactory.getLogger(AnalysisTaskQueue.class);

  private final ThreadPoolTaskExecutor executor;

  public AnalysisTaskQueue(@Qualifier("analysisExecutor") ThreadPoolTaskExecutor executor) {
    this.executor = executor;
  }

  /**
   * Queues a task.
   *
   * @throws TaskRejectedException when the queue is full or the pool is shutting down
   */
  public void submit(Runnable task) {
    executor.execute(task);
    log.debug("Queued analysis task, {} waiting", pending());
  }

  public int pending() {
    return executor.getThreadPoolExecutor().getQueue().size();
  }
}
