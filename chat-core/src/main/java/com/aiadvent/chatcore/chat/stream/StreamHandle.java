package com.aiadvent.chatcore.chat.stream;

import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One in-flight assistant response for a session.
 *
 * <p>The chunk log is append-only and guarded by the handle's own lock. Every append republishes
 * the joined content through a replay-latest sink, so a late subscriber first receives the
 * content produced so far and then every later update. Once the handle is terminal, no chunk is
 * accepted and the content flux completes.
 */
public class StreamHandle {

  private static final Logger log = LoggerFactory.getLogger(StreamHandle.class);
  private static final AtomicLong COUNTER = new AtomicLong();

  private final String threadId;
  private final String sessionId;
  private final Instant startedAt;
  private final long startNanos;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<String> chunks = new ArrayList<>();
  private final StringBuilder content = new StringBuilder();
  private final AtomicBoolean cancellationRequested = new AtomicBoolean();
  private final AtomicBoolean released = new AtomicBoolean();

  private final Sinks.Many<String> contentSink = Sinks.many().replay().latest();
  private final Sinks.One<StreamState> terminationSink = Sinks.one();

  private volatile StreamState state = StreamState.CREATED;
  private volatile StoredMessage savedMessage;
  private volatile String error;
  private volatile Future<?> task;

  StreamHandle(String sessionId) {
    this.sessionId = sessionId;
    this.threadId = sessionId + "_" + System.currentTimeMillis() + "-" + COUNTER.incrementAndGet();
    this.startedAt = Instant.now();
    this.startNanos = System.nanoTime();
  }

  public String threadId() {
    return threadId;
  }

  public String sessionId() {
    return sessionId;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  public StreamState state() {
    return state;
  }

  public boolean isComplete() {
    return state == StreamState.COMPLETED;
  }

  public boolean hasFailed() {
    return state == StreamState.FAILED;
  }

  public boolean isCancelled() {
    return state == StreamState.CANCELLED;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  public boolean isCancellationRequested() {
    return cancellationRequested.get();
  }

  public List<String> chunks() {
    lock.lock();
    try {
      return List.copyOf(chunks);
    } finally {
      lock.unlock();
    }
  }

  public boolean hasChunks() {
    lock.lock();
    try {
      return !chunks.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  public String currentContent() {
    lock.lock();
    try {
      return content.toString();
    } finally {
      lock.unlock();
    }
  }

  /** Replays the latest joined content, then emits every later one; completes once terminal. */
  public Flux<String> contentUpdates() {
    return contentSink.asFlux();
  }

  /** Emits the terminal state once the handle finishes. */
  public Mono<StreamState> termination() {
    return terminationSink.asMono();
  }

  public Optional<StoredMessage> savedMessage() {
    return Optional.ofNullable(savedMessage);
  }

  public Optional<String> error() {
    return Optional.ofNullable(error);
  }

  void markStreaming() {
    lock.lock();
    try {
      if (state == StreamState.CREATED) {
        state = StreamState.STREAMING;
      }
    } finally {
      lock.unlock();
    }
  }

  boolean appendChunk(String chunk) {
    lock.lock();
    try {
      if (state.isTerminal()) {
        return false;
      }
      chunks.add(chunk);
      content.append(chunk);
      emit(content.toString());
      return true;
    } finally {
      lock.unlock();
    }
  }

  boolean complete(StoredMessage saved) {
    return terminate(StreamState.COMPLETED, saved, null);
  }

  boolean fail(StoredMessage saved, String reason) {
    return terminate(StreamState.FAILED, saved, reason);
  }

  /**
   * Requests cancellation and interrupts the production task. Returns {@code true} only for the
   * call that moved the handle into {@link StreamState#CANCELLED}.
   */
  boolean cancel() {
    cancellationRequested.set(true);
    boolean cancelled = terminate(StreamState.CANCELLED, null, null);
    Future<?> current = task;
    if (current != null) {
      current.cancel(true);
    }
    return cancelled;
  }

  void attachTask(Future<?> future) {
    this.task = future;
    if (cancellationRequested.get()) {
      future.cancel(true);
    }
  }

  /** Returns {@code true} exactly once, for the caller that should free the handle's slot. */
  boolean release() {
    return released.compareAndSet(false, true);
  }

  boolean isReleased() {
    return released.get();
  }

  private boolean terminate(StreamState target, StoredMessage saved, String reason) {
    lock.lock();
    try {
      if (state.isTerminal()) {
        return false;
      }
      this.savedMessage = saved;
      this.error = reason;
      this.state = target;
      Sinks.EmitResult completeResult = contentSink.tryEmitComplete();
      if (completeResult.isFailure()) {
        log.warn("Failed to complete content updates of stream {}: {}", threadId, completeResult);
      }
      Sinks.EmitResult terminationResult = terminationSink.tryEmitValue(target);
      if (terminationResult.isFailure()) {
        log.warn("Failed to signal termination of stream {}: {}", threadId, terminationResult);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void emit(String joined) {
    Sinks.EmitResult result = contentSink.tryEmitNext(joined);
    if (result.isFailure()) {
      log.warn("Dropped content update for stream {}: {}", threadId, result);
    }
  }
}
