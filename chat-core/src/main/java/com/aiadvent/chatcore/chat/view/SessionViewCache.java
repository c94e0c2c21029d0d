package com.aiadvent.chatcore.chat.view;

import com.aiadvent.chatcore.chat.stream.StreamOrchestrator;
import com.aiadvent.chatcore.chat.telemetry.StreamTelemetry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of per-session view states, evicted in insertion order.
 *
 * <p>The active session and sessions with a running stream are never chosen while another entry
 * can go. When every entry is protected, {@link EvictionFallback} decides whether the cache grows
 * past its capacity or drops the oldest non-active entry.
 */
public class SessionViewCache {

  private static final Logger log = LoggerFactory.getLogger(SessionViewCache.class);

  private final SessionViewFactory factory;
  private final StreamOrchestrator orchestrator;
  private final StreamTelemetry telemetry;
  private final int capacity;
  private final EvictionFallback fallback;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, SessionViewState> entries = new LinkedHashMap<>();
  private volatile String activeSessionId;

  public SessionViewCache(
      SessionViewFactory factory,
      StreamOrchestrator orchestrator,
      StreamTelemetry telemetry,
      int capacity,
      EvictionFallback fallback) {
    this.factory = factory;
    this.orchestrator = orchestrator;
    this.telemetry = telemetry;
    this.capacity = Math.max(1, capacity);
    this.fallback = fallback != null ? fallback : EvictionFallback.OVERFLOW;
  }

  public SessionViewState getOrCreate(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session id must not be empty");
    }
    List<SessionViewState> evicted = new ArrayList<>();
    SessionViewState state;
    lock.lock();
    try {
      state = entries.get(sessionId);
      if (state != null) {
        // shrink back after an overflow once entries became safe to drop
        while (entries.size() > capacity) {
          SessionViewState victim = evictSafe(sessionId);
          if (victim == null) {
            break;
          }
          evicted.add(victim);
        }
      } else {
        while (entries.size() >= capacity) {
          SessionViewState victim = evictOne(sessionId);
          if (victim == null) {
            log.warn(
                "View cache is full ({} entries) and every entry is active or streaming; "
                    + "keeping {} over capacity",
                entries.size(),
                sessionId);
            break;
          }
          evicted.add(victim);
        }
        state = factory.create(sessionId);
        entries.put(sessionId, state);
      }
    } finally {
      lock.unlock();
    }
    evicted.forEach(SessionViewState::cleanup);
    return state;
  }

  public Optional<SessionViewState> get(String sessionId) {
    lock.lock();
    try {
      return Optional.ofNullable(entries.get(sessionId));
    } finally {
      lock.unlock();
    }
  }

  /** Makes the session the one on screen and reloads it. */
  public SessionViewState switchToSession(String sessionId) {
    detachActive(sessionId);
    setActiveSession(sessionId);
    SessionViewState state = getOrCreate(sessionId);
    state.resume();
    return state;
  }

  /** Makes a session without history the one on screen. */
  public SessionViewState createNewSession(String sessionId) {
    detachActive(sessionId);
    setActiveSession(sessionId);
    SessionViewState state = getOrCreate(sessionId);
    state.startFresh();
    return state;
  }

  public void setActiveSession(String sessionId) {
    this.activeSessionId = sessionId;
  }

  public void clearActiveSession() {
    this.activeSessionId = null;
  }

  public Optional<String> activeSessionId() {
    return Optional.ofNullable(activeSessionId);
  }

  /** Stops the session's stream and drops its view state. */
  public void closeSession(String sessionId) {
    if (orchestrator.hasActiveStream(sessionId)) {
      orchestrator.stopStream(sessionId);
    }
    SessionViewState removed;
    lock.lock();
    try {
      removed = entries.remove(sessionId);
    } finally {
      lock.unlock();
    }
    if (sessionId != null && sessionId.equals(activeSessionId)) {
      clearActiveSession();
    }
    if (removed != null) {
      removed.cleanup();
    }
    log.debug("Closed session {}", sessionId);
  }

  public void shutdown() {
    orchestrator.stopAll();
    List<SessionViewState> all;
    lock.lock();
    try {
      all = new ArrayList<>(entries.values());
      entries.clear();
    } finally {
      lock.unlock();
    }
    clearActiveSession();
    all.forEach(SessionViewState::cleanup);
    log.info("View cache shut down, {} entries released", all.size());
  }

  public CacheStats stats() {
    lock.lock();
    try {
      int total = entries.size();
      int active = 0;
      for (String sessionId : entries.keySet()) {
        if (isProtected(sessionId)) {
          active++;
        }
      }
      return new CacheStats(total, active, total - active, capacity);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String sessionId) {
    lock.lock();
    try {
      return entries.containsKey(sessionId);
    } finally {
      lock.unlock();
    }
  }

  private void detachActive(String nextSessionId) {
    String previous = activeSessionId;
    if (previous == null || previous.equals(nextSessionId)) {
      return;
    }
    get(previous).ifPresent(SessionViewState::clearChat);
  }

  private SessionViewState evictOne(String requestedSessionId) {
    SessionViewState victim = evictSafe(requestedSessionId);
    if (victim != null || fallback == EvictionFallback.OVERFLOW) {
      return victim;
    }
    Iterator<Map.Entry<String, SessionViewState>> iterator = entries.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<String, SessionViewState> entry = iterator.next();
      String sessionId = entry.getKey();
      if (sessionId.equals(requestedSessionId) || sessionId.equals(activeSessionId)) {
        continue;
      }
      iterator.remove();
      telemetry.viewEvicted(sessionId, "fallback");
      log.warn("Evicted view of session {} while its stream is still running", sessionId);
      return entry.getValue();
    }
    return null;
  }

  private SessionViewState evictSafe(String requestedSessionId) {
    Iterator<Map.Entry<String, SessionViewState>> iterator = entries.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<String, SessionViewState> entry = iterator.next();
      String sessionId = entry.getKey();
      if (sessionId.equals(requestedSessionId) || isProtected(sessionId)) {
        continue;
      }
      iterator.remove();
      telemetry.viewEvicted(sessionId, "safe");
      log.debug("Evicted view of session {}", sessionId);
      return entry.getValue();
    }
    return null;
  }

  private boolean isProtected(String sessionId) {
    return sessionId.equals(activeSessionId) || orchestrator.hasActiveStream(sessionId);
  }
}
