package com.aiadvent.chatcore.chat.stream;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * Attaches one consumer to session streams, keeping at most one live subscription per session.
 *
 * <p>Call {@link #subscribe} from the consumer's own thread: the replay is delivered on the
 * calling thread, live updates on the consumer's scheduler. Updates are only delivered while
 * {@code stillObserving} holds for the session.
 */
public class StreamSubscriber {

  private static final Logger log = LoggerFactory.getLogger(StreamSubscriber.class);

  private final StreamOrchestrator orchestrator;
  private final Scheduler scheduler;
  private final Predicate<String> stillObserving;
  private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();

  public StreamSubscriber(
      StreamOrchestrator orchestrator, Scheduler scheduler, Predicate<String> stillObserving) {
    this.orchestrator = orchestrator;
    this.scheduler = scheduler;
    this.stillObserving = stillObserving;
  }

  /**
   * Replaces any previous subscription for the session. Returns {@code false} when the session has
   * no active stream.
   */
  public boolean subscribe(String sessionId, StreamObserver observer) {
    unsubscribe(sessionId);

    Optional<StreamHandle> active = orchestrator.getActiveThread(sessionId);
    if (active.isEmpty()) {
      return false;
    }
    StreamHandle handle = active.get();

    AtomicInteger delivered = new AtomicInteger();
    String replay = handle.currentContent();
    if (!replay.isEmpty() && stillObserving.test(sessionId)) {
      observer.onReplay(handle, replay);
      delivered.set(replay.length());
    }

    Subscription subscription = new Subscription();
    subscriptions.put(sessionId, subscription);
    Disposable live =
        handle
            .contentUpdates()
            .publishOn(scheduler)
            .filter(content -> stillObserving.test(sessionId))
            .filter(content -> content.length() > delivered.get())
            .subscribe(
                content -> {
                  delivered.set(content.length());
                  observer.onContent(handle, content);
                },
                error -> {
                  log.error("Content updates of stream {} failed", handle.threadId(), error);
                  finish(sessionId, subscription, handle, observer);
                },
                () -> finish(sessionId, subscription, handle, observer));
    subscription.attach(live);
    log.debug("Subscribed to stream {} of session {}", handle.threadId(), sessionId);
    return true;
  }

  public void unsubscribe(String sessionId) {
    Disposable previous = subscriptions.remove(sessionId);
    if (previous != null) {
      previous.dispose();
    }
  }

  public void unsubscribeAll() {
    for (String sessionId : subscriptions.keySet()) {
      unsubscribe(sessionId);
    }
  }

  public boolean isSubscribed(String sessionId) {
    return subscriptions.containsKey(sessionId);
  }

  private void finish(
      String sessionId, Subscription subscription, StreamHandle handle, StreamObserver observer) {
    if (!subscriptions.remove(sessionId, subscription)) {
      return;
    }
    if (stillObserving.test(sessionId)) {
      observer.onTerminated(handle);
    }
  }

  /** Holder that can be registered before the live subscription exists. */
  private static final class Subscription implements Disposable {

    private volatile Disposable delegate;
    private volatile boolean disposed;

    void attach(Disposable live) {
      this.delegate = live;
      if (disposed) {
        live.dispose();
      }
    }

    @Override
    public void dispose() {
      disposed = true;
      Disposable current = delegate;
      if (current != null) {
        current.dispose();
      }
    }

    @Override
    public boolean isDisposed() {
      return disposed;
    }
  }
}
