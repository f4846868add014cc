package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.config.PtySettings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded set of PTY sessions keyed by owner key ({@code channel:thread}).
 *
 * <p>
 * Pool bookkeeping is serialized on one lock. Sessions are started while the
 * lock is held so two callers cannot spawn the same key; stopping evicted or
 * expired sessions happens outside it where the caller does not need the
 * slot.
 * </p>
 *
 * @since 1.0
 */
public final class PtyPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyPool.class);

  private final PtySettings settings;
  private final PtySessionFactory sessionFactory;
  private final Clock clock;
  private final Object lock = new Object();
  private final Map<String, PtySession> sessions = new LinkedHashMap<>();

  private ScheduledExecutorService sweeper;

  public PtyPool(final PtySettings settings, final PtySessionFactory sessionFactory, final Clock clock) {
    Validate.notNull(settings, "settings must not be null");
    Validate.notNull(sessionFactory, "sessionFactory must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.settings = settings;
    this.sessionFactory = sessionFactory;
    this.clock = clock;
  }

  /**
   * Returns the live session for {@code config.key()}, starting one if
   * needed.
   *
   * @throws PoolExhaustedException when the pool is full and nothing is idle
   * @throws SessionStartException when a new session fails to start
   */
  public PtySession getOrCreate(final PtySessionConfig config) {
    Validate.notNull(config, "config must not be null");
    final String key = config.key();
    synchronized (lock) {
      final PtySession existing = sessions.get(key);
      if (existing != null) {
        if (existing.isAlive() && existing.state().isReusable()) {
          return existing;
        }
        LOGGER.info("Replacing stale PTY session {} ({})", key, existing.state());
        sessions.remove(key);
        existing.terminate();
      }

      if (sessions.size() >= settings.maxSessions()) {
        final PtySession victim = claimOldestIdle();
        if (victim == null) {
          throw new PoolExhaustedException(settings.maxSessions());
        }
        LOGGER.info("Evicting idle PTY session {} to make room for {}", victim.key(), key);
        sessions.remove(victim.key());
        victim.terminate();
      }

      final PtySession session = sessionFactory.create(config);
      try {
        session.start();
      } catch (SessionStartException e) {
        LOGGER.warn("Failed to start PTY session for {}: {}", key, e.getMessage());
        throw e;
      } catch (RuntimeException e) {
        session.terminate();
        throw new SessionStartException("Failed to start PTY session for " + key, e);
      }
      sessions.put(key, session);
      LOGGER.info("PTY pool holds {} of {} sessions", sessions.size(), settings.maxSessions());
      return session;
    }
  }

  public PtySession get(final String key) {
    synchronized (lock) {
      return sessions.get(key);
    }
  }

  /**
   * Stops and removes one session.
   *
   * @return true when the key was pooled
   */
  public boolean remove(final String key) {
    final PtySession session;
    synchronized (lock) {
      session = sessions.remove(key);
    }
    if (session == null) {
      return false;
    }
    session.terminate();
    return true;
  }

  /**
   * Stops and removes every session whose key is {@code prefix} or starts
   * with {@code prefix + ":"}.
   *
   * @return number of sessions removed
   */
  public int removeByOwnerPrefix(final String prefix) {
    Validate.notBlank(prefix, "prefix must not be blank");
    final String scoped = prefix + ":";
    final List<PtySession> removed = new ArrayList<>();
    synchronized (lock) {
      sessions.entrySet().removeIf(entry -> {
        final String key = entry.getKey();
        if (key.equals(prefix) || key.startsWith(scoped)) {
          removed.add(entry.getValue());
          return true;
        }
        return false;
      });
    }
    removed.forEach(PtySession::terminate);
    return removed.size();
  }

  /**
   * Sends Ctrl-C to one session.
   *
   * @return true when the session exists and the byte was written
   */
  public boolean interrupt(final String key) {
    final PtySession session = get(key);
    return session != null && session.interrupt();
  }

  /**
   * Removes dead sessions and IDLE sessions inactive for longer than the idle
   * timeout.
   *
   * @return number of sessions removed
   */
  public int sweep() {
    final Instant now = clock.instant();
    final List<PtySession> expired = new ArrayList<>();
    synchronized (lock) {
      sessions.values().removeIf(session -> {
        final boolean dead = !session.isAlive();
        final boolean idleTooLong = !dead
                && session.state() == PtySessionState.IDLE
                && Duration.between(session.lastActivityAt(), now).compareTo(settings.idleTimeout()) > 0
                && session.claimForStop();
        if (dead || idleTooLong) {
          expired.add(session);
          return true;
        }
        return false;
      });
    }
    for (PtySession session : expired) {
      LOGGER.info("Sweeping PTY session {} ({})", session.key(), session.state());
      session.terminate();
    }
    return expired.size();
  }

  /**
   * Starts the periodic sweep on a daemon thread. Calling it again has no
   * effect.
   */
  public void startSweeper() {
    synchronized (lock) {
      if (sweeper != null) {
        return;
      }
      sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "pty-pool-sweeper");
        t.setDaemon(true);
        return t;
      });
      final long periodMillis = settings.sweepInterval().toMillis();
      sweeper.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }
  }

  public List<SessionInfo> describe() {
    final List<PtySession> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(sessions.values());
    }
    final List<SessionInfo> out = new ArrayList<>(snapshot.size());
    for (PtySession session : snapshot) {
      out.add(session.describe());
    }
    return out;
  }

  public int size() {
    synchronized (lock) {
      return sessions.size();
    }
  }

  /**
   * Stops the sweeper and every pooled session.
   */
  @Override
  public void close() {
    final List<PtySession> all;
    synchronized (lock) {
      if (sweeper != null) {
        sweeper.shutdownNow();
        sweeper = null;
      }
      all = new ArrayList<>(sessions.values());
      sessions.clear();
    }
    all.forEach(PtySession::terminate);
    LOGGER.info("PTY pool closed; stopped {} sessions", all.size());
  }

  /**
   * Claims the least recently active IDLE session, skipping any that started a
   * turn since they were looked at.
   */
  private PtySession claimOldestIdle() {
    final List<PtySession> idle = new ArrayList<>();
    for (PtySession session : sessions.values()) {
      if (session.state() == PtySessionState.IDLE) {
        idle.add(session);
      }
    }
    idle.sort(Comparator.comparing(PtySession::lastActivityAt));
    for (PtySession candidate : idle) {
      if (candidate.claimForStop()) {
        return candidate;
      }
      LOGGER.debug("PTY session {} became busy before eviction; skipping", candidate.key());
    }
    return null;
  }

  private void sweepSafely() {
    try {
      final int removed = sweep();
      if (removed > 0) {
        LOGGER.info("PTY sweep removed {} sessions", removed);
      }
    } catch (RuntimeException e) {
      LOGGER.error("PTY sweep failed", e);
    }
  }
}
