package com.scholary.songscraper.service;

import com.scholary.songscraper.config.ScraperProperties;
import com.scholary.songscraper.error.ArchivingException;
import com.scholary.songscraper.error.InvalidStateException;
import com.scholary.songscraper.error.NotFoundException;
import com.scholary.songscraper.job.JobRepository;
import com.scholary.songscraper.job.JobSnapshot;
import com.scholary.songscraper.job.JobState;
import com.scholary.songscraper.job.ScrapeJob;
import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.logging.StructuredLogger;
import com.scholary.songscraper.notification.JobFinishedEvent;
import com.scholary.songscraper.notification.JobStateChangedEvent;
import com.scholary.songscraper.notification.ProgressPublisher;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.progress.Phase;
import com.scholary.songscraper.progress.PhaseStatus;
import com.scholary.songscraper.progress.ProgressTracker;
import com.scholary.songscraper.worker.JobCompletionListener;
import com.scholary.songscraper.worker.SongWorkerPool;
import java.net.URL;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Owns scrape jobs from submission to their terminal state.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Validate the song list and store a QUEUED job
 *   <li>Open the lyrics and audio phases and hand the songs to the worker pool
 *   <li>Once the pool drains the job, decide its outcome: cancelled, failed, or archived into a
 *       bundle and completed
 * </ol>
 *
 * <p>Public operations never wait for song tasks. Resolution and archiving run on the worker thread
 * that drained the job.
 */
@Service
public class JobManager implements JobCompletionListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobManager.class);

  private final JobRepository jobRepository;
  private final ProgressTracker progressTracker;
  private final ProgressPublisher progress;
  private final SongWorkerPool workerPool;
  private final BundleWriter bundleWriter;
  private final SongListValidator validator;
  private final JobIdGenerator idGenerator;
  private final ObjectStoreClient objectStore;
  private final ApplicationEventPublisher eventPublisher;
  private final ScraperProperties properties;
  private final Clock clock;

  public JobManager(
      JobRepository jobRepository,
      ProgressTracker progressTracker,
      ProgressPublisher progress,
      SongWorkerPool workerPool,
      BundleWriter bundleWriter,
      SongListValidator validator,
      JobIdGenerator idGenerator,
      ObjectStoreClient objectStore,
      ApplicationEventPublisher eventPublisher,
      ScraperProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.progressTracker = progressTracker;
    this.progress = progress;
    this.workerPool = workerPool;
    this.bundleWriter = bundleWriter;
    this.validator = validator;
    this.idGenerator = idGenerator;
    this.objectStore = objectStore;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Create a job for the songs and queue it.
   *
   * @return the job id
   * @throws com.scholary.songscraper.error.ValidationException if the song list is rejected
   */
  public String submit(long userId, List<SongRequest> songs) {
    validator.validateBatch(songs);

    List<SongRequest> normalized =
        songs.stream()
            .map(
                song ->
                    new SongRequest(
                        song.title().trim(),
                        song.artist().trim(),
                        song.url().trim(),
                        song.event() == null || song.event().isBlank()
                            ? null
                            : song.event().trim()))
            .collect(Collectors.toList());

    String jobId = idGenerator.next(userId);
    ScrapeJob job = new ScrapeJob(jobId, userId, normalized, clock.instant());
    jobRepository.insert(job);

    progress.open(jobId, Phase.LYRICS, job.getTotalSongs());
    progress.open(jobId, Phase.AUDIO, job.getTotalSongs());

    LOGGER.info("Job submitted: jobId={}, userId={}, songs={}", jobId, userId, normalized.size());
    eventPublisher.publishEvent(
        new JobStateChangedEvent(jobId, userId, null, JobState.QUEUED, job.getCreatedAt()));

    workerPool.dispatch(job, this);
    return jobId;
  }

  public JobStatusView status(String jobId) {
    ScrapeJob job = find(jobId);
    return new JobStatusView(job.snapshot(), progressTracker.phases(jobId));
  }

  /**
   * Request cooperative cancellation. Songs already running finish; the rest are skipped and the
   * job ends CANCELLED.
   *
   * @throws InvalidStateException if the job is archiving or terminal
   * @throws com.scholary.songscraper.error.ConflictException if cancellation is already pending
   */
  public JobSnapshot cancel(String jobId) {
    ScrapeJob job = find(jobId);
    job.requestCancellation(clock.instant());
    LOGGER.info("Cancellation requested: jobId={}", jobId);

    workerPool.onCancelRequested(jobId);
    return job.snapshot();
  }

  /** All jobs of a user, newest first. */
  public List<JobSnapshot> listForUser(long userId) {
    return jobRepository.findByUserId(userId).stream()
        .map(ScrapeJob::snapshot)
        .collect(Collectors.toList());
  }

  /** Number of known jobs per state; every state is present. */
  public Map<JobState, Long> statistics() {
    Map<JobState, Long> counts = new EnumMap<>(JobState.class);
    for (JobState state : JobState.values()) {
      counts.put(state, 0L);
    }
    for (ScrapeJob job : jobRepository.findAll()) {
      counts.merge(job.getState(), 1L, Long::sum);
    }
    return counts;
  }

  /**
   * A fresh time-limited link to a completed job's bundle.
   *
   * @throws InvalidStateException if the job is not completed
   * @throws NotFoundException if the bundle has already been retired
   */
  public URL downloadLink(String jobId) {
    JobSnapshot job = find(jobId).snapshot();
    if (job.state() != JobState.COMPLETED) {
      throw new InvalidStateException(
          String.format("Job %s has no bundle in state %s", jobId, job.state()));
    }
    if (job.bundleKey() == null) {
      throw new NotFoundException("Bundle for job " + jobId + " is no longer available");
    }
    return objectStore.presignGet(job.bundleKey(), properties.downloadUrlTtl());
  }

  @Override
  public void onJobStarted(ScrapeJob job) {
    eventPublisher.publishEvent(
        new JobStateChangedEvent(
            job.getJobId(), job.getUserId(), JobState.QUEUED, JobState.RUNNING, clock.instant()));
  }

  @Override
  public void onJobDrained(ScrapeJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getUserId());
    try {
      JobState before = job.getState();
      ScrapeJob.Resolution resolution = job.beginResolution(clock.instant());
      publishTransition(job, before);

      switch (resolution) {
        case CANCELLED:
          finalizeSongPhases(job.getJobId(), PhaseStatus.FAILED, "Job cancelled");
          break;
        case FAILED:
          finalizeSongPhases(job.getJobId(), PhaseStatus.FAILED, job.snapshot().errorMessage());
          break;
        case ARCHIVE:
          finalizeSongPhases(job.getJobId(), PhaseStatus.COMPLETED, null);
          archive(job);
          break;
        default:
          throw new IllegalStateException("Unknown resolution: " + resolution);
      }

      JobSnapshot finished = job.snapshot();
      eventPublisher.publishEvent(
          new JobFinishedEvent(
              finished.jobId(),
              finished.userId(),
              finished.state(),
              finished.totalSongs(),
              finished.completedSongs(),
              finished.failedSongs(),
              finished.bundleUrl(),
              finished.errorMessage(),
              finished.completedAt()));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void archive(ScrapeJob job) {
    String jobId = job.getJobId();
    try {
      BundleWriter.Bundle bundle = bundleWriter.write(job.snapshot());
      progress.finalizePhase(jobId, Phase.ARCHIVING, PhaseStatus.COMPLETED, null);
      job.completeArchiving(bundle.key(), bundle.url(), clock.instant());
      eventPublisher.publishEvent(
          new JobStateChangedEvent(
              jobId, job.getUserId(), JobState.ARCHIVING, JobState.COMPLETED, clock.instant()));
    } catch (ArchivingException e) {
      LOGGER.error("Archiving failed: jobId={}", jobId, e);
      failArchiving(job, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error while archiving: jobId={}", jobId, e);
      failArchiving(job, "Unexpected error: " + e.getMessage());
    }
  }

  private void failArchiving(ScrapeJob job, String reason) {
    progress.finalizePhase(job.getJobId(), Phase.ARCHIVING, PhaseStatus.FAILED, reason);
    job.failArchiving("Archiving failed: " + reason, clock.instant());
    eventPublisher.publishEvent(
        new JobStateChangedEvent(
            job.getJobId(), job.getUserId(), JobState.ARCHIVING, JobState.FAILED, clock.instant()));
  }

  private void finalizeSongPhases(String jobId, PhaseStatus status, String detail) {
    progress.finalizePhase(jobId, Phase.LYRICS, status, detail);
    progress.finalizePhase(jobId, Phase.AUDIO, status, detail);
  }

  private void publishTransition(ScrapeJob job, JobState before) {
    JobState after = job.getState();
    if (after != before) {
      eventPublisher.publishEvent(
          new JobStateChangedEvent(
              job.getJobId(), job.getUserId(), before, after, clock.instant()));
    }
  }

  private ScrapeJob find(String jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
  }
}
