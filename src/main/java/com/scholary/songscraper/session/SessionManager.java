package com.scholary.songscraper.session;

import com.scholary.songscraper.error.ConflictException;
import com.scholary.songscraper.error.InvalidStateException;
import com.scholary.songscraper.error.NotFoundException;
import com.scholary.songscraper.error.ValidationException;
import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.service.JobManager;
import com.scholary.songscraper.service.SongListValidator;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives the interactive song-list builder.
 *
 * <p>A session collects title, artist and URL one field at a time, then waits for confirmation.
 * Confirmed songs accumulate in the session queue, which survives cancel and finish and is only
 * emptied by {@link #clear} or {@link #submitQueue}.
 */
@Service
public class SessionManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);
  private static final SessionType TYPE = SessionType.ADD_SONG;

  private final SessionRepository sessionRepository;
  private final SongListValidator validator;
  private final EventLabelExtractor eventLabelExtractor;
  private final JobManager jobManager;
  private final Clock clock;

  public SessionManager(
      SessionRepository sessionRepository,
      SongListValidator validator,
      EventLabelExtractor eventLabelExtractor,
      JobManager jobManager,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.validator = validator;
    this.eventLabelExtractor = eventLabelExtractor;
    this.jobManager = jobManager;
    this.clock = clock;
  }

  /**
   * Begin collecting a song.
   *
   * @throws ConflictException if the user already has an active session
   */
  public SessionSnapshot start(long userId) {
    UserSession session = sessionRepository.getOrCreate(userId, TYPE);
    synchronized (session) {
      if (session.getState().isActive()) {
        throw new ConflictException(
            String.format(
                "User %d already has an active session in state %s", userId, session.getState()));
      }
      session.moveTo(SessionState.AWAITING_TITLE, SongDraft.EMPTY, clock.instant());
      LOGGER.debug("Session started: userId={}", userId);
      return session.snapshot();
    }
  }

  /**
   * Supply the field the current state expects. In AWAITING_CONFIRMATION the value sets the event
   * label and the state does not change.
   *
   * @throws ValidationException if the value is not acceptable for the expected field
   * @throws InvalidStateException if no song is being collected
   */
  public SessionSnapshot submitField(long userId, String value) {
    UserSession session = activeSession(userId);
    synchronized (session) {
      SongDraft draft = session.getDraft();
      switch (session.getState()) {
        case AWAITING_TITLE:
          session.moveTo(
              SessionState.AWAITING_ARTIST,
              draft.withTitle(validator.validateTitle(value)),
              clock.instant());
          break;
        case AWAITING_ARTIST:
          session.moveTo(
              SessionState.AWAITING_URL,
              draft.withArtist(validator.validateArtist(value)),
              clock.instant());
          break;
        case AWAITING_URL:
          String url = validator.validateUrl(value);
          String event = eventLabelExtractor.extract(url).orElse(null);
          session.moveTo(
              SessionState.AWAITING_CONFIRMATION, draft.withUrl(url, event), clock.instant());
          break;
        case AWAITING_CONFIRMATION:
          session.moveTo(
              SessionState.AWAITING_CONFIRMATION,
              draft.withEvent(validator.validateEvent(value)),
              clock.instant());
          break;
        default:
          throw new InvalidStateException("No song is being added for user " + userId);
      }
      return session.snapshot();
    }
  }

  /**
   * Append the draft to the queue and start collecting the next song.
   *
   * @throws InvalidStateException unless the session awaits confirmation
   */
  public SessionSnapshot confirm(long userId) {
    UserSession session = activeSession(userId);
    synchronized (session) {
      requireState(session, SessionState.AWAITING_CONFIRMATION, "confirm");
      SongRequest song = session.getDraft().toRequest();
      session.enqueue(song, clock.instant());
      session.moveTo(SessionState.AWAITING_TITLE, SongDraft.EMPTY, clock.instant());
      LOGGER.info("Song queued: userId={}, title={}", userId, song.title());
      return session.snapshot();
    }
  }

  /**
   * Stop adding songs. Only legal before a new title was entered.
   *
   * @throws InvalidStateException unless the session awaits a title
   */
  public SessionSnapshot finish(long userId) {
    UserSession session = activeSession(userId);
    synchronized (session) {
      requireState(session, SessionState.AWAITING_TITLE, "finish");
      session.moveTo(SessionState.IDLE, SongDraft.EMPTY, clock.instant());
      return session.snapshot();
    }
  }

  /**
   * Abandon the song being collected. The queue is left untouched.
   *
   * @throws NotFoundException if the user never started a session
   * @throws InvalidStateException if the session is idle
   */
  public SessionSnapshot cancel(long userId) {
    UserSession session =
        sessionRepository
            .find(userId, TYPE)
            .orElseThrow(() -> new NotFoundException("No session for user " + userId));
    synchronized (session) {
      if (!session.getState().isActive()) {
        throw new InvalidStateException("Session for user " + userId + " is not active");
      }
      session.moveTo(SessionState.IDLE, SongDraft.EMPTY, clock.instant());
      LOGGER.debug("Session cancelled: userId={}", userId);
      return session.snapshot();
    }
  }

  /** Confirmed songs, in confirmation order. Empty if the user has no session. */
  public List<SongRequest> queue(long userId) {
    return sessionRepository.find(userId, TYPE).map(UserSession::queuedSongs).orElse(List.of());
  }

  public SessionSnapshot snapshot(long userId) {
    return sessionRepository
        .find(userId, TYPE)
        .map(UserSession::snapshot)
        .orElseThrow(() -> new NotFoundException("No session for user " + userId));
  }

  /** Empty the queue and return to idle. A user without a session is left alone. */
  public void clear(long userId) {
    sessionRepository.find(userId, TYPE).ifPresent(session -> session.clearQueue(clock.instant()));
  }

  /**
   * Submit the queued songs as a scrape job, then clear the queue.
   *
   * @return the job id
   * @throws ValidationException if the queue is empty or rejected by the job manager
   */
  public String submitQueue(long userId) {
    UserSession session =
        sessionRepository
            .find(userId, TYPE)
            .orElseThrow(() -> new ValidationException("No songs queued for user " + userId));
    synchronized (session) {
      List<SongRequest> songs = session.queuedSongs();
      if (songs.isEmpty()) {
        throw new ValidationException("No songs queued for user " + userId);
      }
      String jobId = jobManager.submit(userId, songs);
      session.clearQueue(clock.instant());
      LOGGER.info("Queue submitted: userId={}, jobId={}, songs={}", userId, jobId, songs.size());
      return jobId;
    }
  }

  private UserSession activeSession(long userId) {
    return sessionRepository
        .find(userId, TYPE)
        .filter(session -> session.getState().isActive())
        .orElseThrow(
            () -> new InvalidStateException("No active session for user " + userId));
  }

  private static void requireState(UserSession session, SessionState expected, String operation) {
    if (session.getState() != expected) {
      throw new InvalidStateException(
          String.format(
              "Cannot %s in state %s (expected %s)", operation, session.getState(), expected));
    }
  }
}
