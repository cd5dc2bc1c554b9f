package com.scholary.songscraper.session;

import com.scholary.songscraper.job.SongRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable session state for one user and session type.
 *
 * <p>Compound read-then-write operations synchronize on the session instance.
 */
public class UserSession {

  private final long userId;
  private final SessionType type;
  private final List<SongRequest> queue = new ArrayList<>();

  private SessionState state = SessionState.IDLE;
  private SongDraft draft = SongDraft.EMPTY;
  private Instant updatedAt;

  public UserSession(long userId, SessionType type, Instant createdAt) {
    this.userId = userId;
    this.type = type;
    this.updatedAt = createdAt;
  }

  public synchronized SessionState getState() {
    return state;
  }

  public synchronized SongDraft getDraft() {
    return draft;
  }

  synchronized void moveTo(SessionState next, SongDraft nextDraft, Instant at) {
    this.state = next;
    this.draft = nextDraft;
    this.updatedAt = at;
  }

  synchronized void enqueue(SongRequest song, Instant at) {
    queue.add(song);
    this.updatedAt = at;
  }

  synchronized List<SongRequest> queuedSongs() {
    return List.copyOf(queue);
  }

  synchronized void clearQueue(Instant at) {
    queue.clear();
    this.state = SessionState.IDLE;
    this.draft = SongDraft.EMPTY;
    this.updatedAt = at;
  }

  public synchronized SessionSnapshot snapshot() {
    return new SessionSnapshot(
        userId, type, state, state.expectedField(), draft, List.copyOf(queue), updatedAt);
  }

  public long getUserId() {
    return userId;
  }

  public SessionType getType() {
    return type;
  }
}
