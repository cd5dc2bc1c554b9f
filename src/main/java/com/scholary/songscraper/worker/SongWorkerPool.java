package com.scholary.songscraper.worker;

import com.scholary.songscraper.job.ScrapeJob;
import com.scholary.songscraper.job.SongItem;
import com.scholary.songscraper.logging.StructuredLogger;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs song tasks on the shared song executor.
 *
 * <p>Every song of every job becomes one task on the same fixed-size executor, so the executor's
 * thread count is the global bound on concurrent fetches and tasks are admitted in submission
 * order. Cancellation is cooperative: a task checks its job's flag when it is admitted and skips
 * the song if the flag is set, while tasks already running finish normally.
 */
@Component
public class SongWorkerPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(SongWorkerPool.class);

  private final Executor executor;
  private final SongProcessor processor;
  private final Clock clock;
  private final StructuredLogger structuredLogger;
  private final Map<String, JobExecution> executions = new ConcurrentHashMap<>();

  public SongWorkerPool(
      @Qualifier("songTaskExecutor") Executor executor, SongProcessor processor, Clock clock) {
    this.executor = executor;
    this.processor = processor;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /** Queue one task per song of the job. Returns without waiting for any of them. */
  public void dispatch(ScrapeJob job, JobCompletionListener listener) {
    JobExecution execution = new JobExecution(job, listener);
    if (executions.putIfAbsent(job.getJobId(), execution) != null) {
      throw new IllegalStateException("Job already dispatched: " + job.getJobId());
    }

    LOGGER.info("Dispatching job: jobId={}, songs={}", job.getJobId(), job.getTotalSongs());
    for (SongItem song : job.getSongs()) {
      try {
        executor.execute(() -> runSong(execution, song));
      } catch (RejectedExecutionException e) {
        LOGGER.warn(
            "Song task rejected: jobId={}, title={}: {}",
            job.getJobId(),
            song.getTitle(),
            e.getMessage());
        execution.abandon();
      }
    }
    drainIfIdle(execution);
  }

  /**
   * Called after a job's cancel flag was raised. Resolves the job right away when none of its
   * songs is running; otherwise the last running song resolves it.
   */
  public void onCancelRequested(String jobId) {
    JobExecution execution = executions.get(jobId);
    if (execution != null) {
      drainIfIdle(execution);
    }
  }

  /** Jobs dispatched and not yet drained. */
  public int activeJobs() {
    return executions.size();
  }

  private void runSong(JobExecution execution, SongItem song) {
    ScrapeJob job = execution.job();
    StructuredLogger.setJobContext(job.getJobId(), job.getUserId());
    try {
      JobExecution.Admission admission = execution.admit(clock.instant());
      if (admission == JobExecution.Admission.SKIPPED) {
        structuredLogger.logSongSkipped(job.getJobId(), song.getTitle());
      } else {
        if (admission == JobExecution.Admission.FIRST) {
          notifyStarted(execution);
        }
        try {
          processor.process(job, song);
        } catch (RuntimeException e) {
          LOGGER.error(
              "Song task failed: jobId={}, title={}", job.getJobId(), song.getTitle(), e);
        } finally {
          execution.release();
        }
      }
      drainIfIdle(execution);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void notifyStarted(JobExecution execution) {
    try {
      execution.listener().onJobStarted(execution.job());
    } catch (RuntimeException e) {
      LOGGER.error("Job start callback failed: jobId={}", execution.job().getJobId(), e);
    }
  }

  private void drainIfIdle(JobExecution execution) {
    if (!execution.claimDrain()) {
      return;
    }
    ScrapeJob job = execution.job();
    executions.remove(job.getJobId());
    LOGGER.debug("Job drained: jobId={}", job.getJobId());
    try {
      execution.listener().onJobDrained(job);
    } catch (RuntimeException e) {
      LOGGER.error("Job drain callback failed: jobId={}", job.getJobId(), e);
    }
  }
}
