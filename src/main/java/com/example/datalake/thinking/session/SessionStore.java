package com.example.datalake.thinking.session;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded registry of thinking sessions keyed by integer id. When full, creating a session first
 * evicts the least recently accessed one. Ids are handed out from a counter and never reused.
 *
 * <p>All operations run under one lock so that lookup, eviction and creation are indivisible
 * with respect to each other.
 */
@Slf4j
public class SessionStore {

  public static final int DEFAULT_MAX_SESSIONS = 1000;

  private final int maxSessions;
  private final boolean renderThoughts;
  private final LongSupplier clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, ThinkingSession> sessions = new HashMap<>();
  private final Map<Long, Long> lastAccess = new HashMap<>();
  private long nextId = 1;
  private long lastStamp = Long.MIN_VALUE;

  public SessionStore() {
    this(DEFAULT_MAX_SESSIONS);
  }

  public SessionStore(int maxSessions) {
    this(maxSessions, false, System::nanoTime);
  }

  public SessionStore(int maxSessions, boolean renderThoughts, LongSupplier clock) {
    if (maxSessions <= 0) {
      throw new IllegalArgumentException("maxSessions must be positive");
    }
    this.maxSessions = maxSessions;
    this.renderThoughts = renderThoughts;
    this.clock = clock;
  }

  /**
   * Returns the session named by {@code candidateId} when it is live, refreshing its access
   * time. Otherwise mints a new session under a fresh id, evicting the least recently accessed
   * session first if the store is full.
   */
  public SessionHandle getOrCreate(String candidateId) {
    OptionalLong parsed = parseId(candidateId);
    lock.lock();
    try {
      if (parsed.isPresent()) {
        long id = parsed.getAsLong();
        ThinkingSession existing = sessions.get(id);
        if (existing != null) {
          lastAccess.put(id, stamp());
          return new SessionHandle(id, existing, true);
        }
      }

      if (sessions.size() >= maxSessions) {
        evictOldestLocked();
      }
      long id = nextId++;
      ThinkingSession session = new ThinkingSession(id, renderThoughts);
      sessions.put(id, session);
      lastAccess.put(id, stamp());
      log.info("Created thinking session {} ({} live)", id, sessions.size());
      return new SessionHandle(id, session, false);
    } finally {
      lock.unlock();
    }
  }

  /** Refreshes the access time of a live session; does nothing for unknown ids. */
  public void touch(long id) {
    lock.lock();
    try {
      if (sessions.containsKey(id)) {
        lastAccess.put(id, stamp());
      }
    } finally {
      lock.unlock();
    }
  }

  /** Removes the least recently accessed session, if any, and returns its id. */
  public OptionalLong evictOldest() {
    lock.lock();
    try {
      return evictOldestLocked();
    } finally {
      lock.unlock();
    }
  }

  public Optional<ThinkingSession> find(long id) {
    lock.lock();
    try {
      return Optional.ofNullable(sessions.get(id));
    } finally {
      lock.unlock();
    }
  }

  public OptionalLong lastAccess(long id) {
    lock.lock();
    try {
      Long stamp = lastAccess.get(id);
      return stamp == null ? OptionalLong.empty() : OptionalLong.of(stamp);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return sessions.size();
    } finally {
      lock.unlock();
    }
  }

  public int getMaxSessions() {
    return maxSessions;
  }

  private OptionalLong evictOldestLocked() {
    long victim = 0;
    long oldest = Long.MAX_VALUE;
    boolean found = false;
    for (Map.Entry<Long, Long> entry : lastAccess.entrySet()) {
      long id = entry.getKey();
      long stamp = entry.getValue();
      if (!found || stamp < oldest || (stamp == oldest && id < victim)) {
        victim = id;
        oldest = stamp;
        found = true;
      }
    }
    if (!found) {
      return OptionalLong.empty();
    }
    ThinkingSession removed = sessions.remove(victim);
    lastAccess.remove(victim);
    log.info("Evicted thinking session {} holding {} thoughts", victim,
        removed == null ? 0 : removed.logLength());
    return OptionalLong.of(victim);
  }

  // strictly increasing even when the clock stalls
  private long stamp() {
    long now = clock.getAsLong();
    lastStamp = lastStamp == Long.MIN_VALUE ? now : Math.max(now, lastStamp + 1);
    return lastStamp;
  }

  static OptionalLong parseId(String candidateId) {
    if (candidateId == null || candidateId.isBlank()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(candidateId.trim()));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }
}
