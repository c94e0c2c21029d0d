package com.aiadvent.chatcore.chat.stream;

import com.aiadvent.chatcore.chat.config.StreamingProperties;
import com.aiadvent.chatcore.chat.persistence.ChatHistoryStore;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.provider.ChatPrompt;
import com.aiadvent.chatcore.chat.provider.ChatResponder;
import com.aiadvent.chatcore.chat.service.PromptContextService;
import com.aiadvent.chatcore.chat.stream.event.StreamCompleted;
import com.aiadvent.chatcore.chat.stream.event.StreamEventPublisher;
import com.aiadvent.chatcore.chat.stream.event.StreamFailed;
import com.aiadvent.chatcore.chat.stream.event.StreamStarted;
import com.aiadvent.chatcore.chat.stream.event.StreamStopped;
import com.aiadvent.chatcore.chat.telemetry.StreamTelemetry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Owns every in-flight response. A stream outlives whichever consumer started it: it keeps
 * running, and is persisted, when nobody is watching.
 *
 * <p>At most one handle exists per session, and at most {@code max-concurrent-streams} exist in
 * total. The user message and the prompt context are prepared on the caller's thread; the
 * provider call runs on the worker pool.
 */
public class StreamOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(StreamOrchestrator.class);

  private final ChatResponder responder;
  private final PromptContextService promptContextService;
  private final ChatHistoryStore historyStore;
  private final StreamEventPublisher eventPublisher;
  private final StreamTelemetry telemetry;
  private final ExecutorService executorService;
  private final StreamingProperties properties;

  private final Map<String, StreamHandle> activeStreams = new ConcurrentHashMap<>();
  private final Semaphore permits;
  private final AtomicBoolean shutdown = new AtomicBoolean();

  public StreamOrchestrator(
      ChatResponder responder,
      PromptContextService promptContextService,
      ChatHistoryStore historyStore,
      StreamEventPublisher eventPublisher,
      StreamTelemetry telemetry,
      ExecutorService executorService,
      StreamingProperties properties) {
    this.responder = responder;
    this.promptContextService = promptContextService;
    this.historyStore = historyStore;
    this.eventPublisher = eventPublisher;
    this.telemetry = telemetry;
    this.executorService = executorService;
    this.properties = properties;
    this.permits = new Semaphore(properties.getMaxConcurrentStreams());
    telemetry.bindActiveStreams(activeStreams::size);
  }

  public SendResult sendMessage(String sessionId, String message) {
    if (!StringUtils.hasText(sessionId)) {
      throw new IllegalArgumentException("Session id must not be empty");
    }
    if (!StringUtils.hasText(message)) {
      throw new IllegalArgumentException("Message must not be empty");
    }
    if (shutdown.get()) {
      return reject(sessionId, SendRejection.SHUT_DOWN);
    }
    if (activeStreams.containsKey(sessionId)) {
      return reject(sessionId, SendRejection.SESSION_BUSY);
    }
    if (!permits.tryAcquire()) {
      return reject(sessionId, SendRejection.CAPACITY_EXCEEDED);
    }

    StreamHandle handle = new StreamHandle(sessionId);
    StreamHandle existing = activeStreams.putIfAbsent(sessionId, handle);
    if (existing != null) {
      handle.release();
      permits.release();
      return reject(sessionId, SendRejection.SESSION_BUSY);
    }

    ChatPrompt prompt;
    try {
      prompt = promptContextService.prepare(sessionId, message);
    } catch (RuntimeException ex) {
      handle.fail(null, describe(ex));
      release(handle);
      log.error("Failed to prepare prompt for session {}", sessionId, ex);
      throw ex;
    }
    if (handle.isCancellationRequested()) {
      // stopped while the prompt was prepared; StreamStopped is already out
      release(handle);
      log.debug("Stream {} for session {} was stopped before it started", handle.threadId(),
          sessionId);
      return SendResult.accepted(handle.threadId());
    }

    eventPublisher.publish(new StreamStarted(sessionId, handle.threadId(), message));

    try {
      Future<?> task = executorService.submit(() -> produce(handle, prompt));
      handle.attachTask(task);
    } catch (RejectedExecutionException ex) {
      log.warn("Worker pool rejected stream {} for session {}", handle.threadId(), sessionId, ex);
      if (handle.cancel()) {
        eventPublisher.publish(new StreamStopped(sessionId, handle.threadId(), null));
      }
      release(handle);
      return reject(sessionId, SendRejection.SHUT_DOWN);
    }

    telemetry.streamAccepted(sessionId, handle.threadId());
    log.debug("Started stream {} for session {}", handle.threadId(), sessionId);
    return SendResult.accepted(handle.threadId());
  }

  public Optional<StreamHandle> getActiveThread(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(activeStreams.get(sessionId));
  }

  public boolean hasActiveStream(String sessionId) {
    return sessionId != null && activeStreams.containsKey(sessionId);
  }

  public int activeStreamCount() {
    return activeStreams.size();
  }

  /**
   * Cancels the session's stream and frees its slot right away. Nothing is persisted for a
   * cancelled response. Returns {@code true} when this call stopped a running stream.
   */
  public boolean stopStream(String sessionId) {
    StreamHandle handle = sessionId != null ? activeStreams.get(sessionId) : null;
    if (handle == null) {
      log.warn("No active stream to stop for session {}", sessionId);
      return false;
    }
    boolean cancelled = handle.cancel();
    if (cancelled) {
      String partial = handle.currentContent();
      eventPublisher.publish(
          new StreamStopped(
              sessionId, handle.threadId(), StringUtils.hasText(partial) ? partial : null));
      telemetry.streamFinished(sessionId, StreamState.CANCELLED, handle.elapsed());
      log.debug("Stopped stream {} for session {}", handle.threadId(), sessionId);
    }
    release(handle);
    return cancelled;
  }

  public void stopAll() {
    List<String> sessionIds = new ArrayList<>(activeStreams.keySet());
    for (String sessionId : sessionIds) {
      stopStream(sessionId);
    }
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down stream orchestrator with {} active streams", activeStreams.size());
    stopAll();
    executorService.shutdown();
    try {
      long timeoutMs = properties.getShutdownTimeout().toMillis();
      if (!executorService.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }

  private void produce(StreamHandle handle, ChatPrompt prompt) {
    String sessionId = handle.sessionId();
    String threadId = handle.threadId();
    try {
      ensureNotCancelled(handle);
      handle.markStreaming();

      String response = responder.streamResponse(prompt, token -> onToken(handle, token));
      ensureNotCancelled(handle);

      String content = response != null ? response : handle.currentContent();
      StoredMessage saved = historyStore.saveAssistantResponse(sessionId, content, false);
      if (handle.complete(saved)) {
        eventPublisher.publish(
            new StreamCompleted(sessionId, threadId, content, handle.elapsed().toMillis()));
        telemetry.streamFinished(sessionId, StreamState.COMPLETED, handle.elapsed());
        log.debug("Stream {} for session {} completed", threadId, sessionId);
      } else {
        log.debug("Stream {} for session {} was stopped while saving its response", threadId,
            sessionId);
      }
    } catch (Exception ex) {
      if (handle.isCancellationRequested()) {
        log.debug("Stream {} for session {} cancelled", threadId, sessionId);
      } else {
        handleFailure(handle, ex);
      }
    } catch (Error error) {
      if (!handle.isCancellationRequested()) {
        handleFailure(handle, error);
      }
      throw error;
    } finally {
      if (!handle.isTerminal()) {
        handleFailure(handle, new IllegalStateException("Stream ended unexpectedly"));
      }
      release(handle);
    }
  }

  private void onToken(StreamHandle handle, String token) {
    ensureNotCancelled(handle);
    if (token == null || token.isEmpty()) {
      return;
    }
    if (!handle.appendChunk(token)) {
      throw new StreamCancelledException(handle.threadId());
    }
  }

  private void handleFailure(StreamHandle handle, Throwable ex) {
    String sessionId = handle.sessionId();
    String reason = describe(ex);
    String partial = handle.currentContent();
    log.error("Stream {} for session {} failed", handle.threadId(), sessionId, ex);

    StoredMessage saved = null;
    try {
      saved = historyStore.saveAssistantResponse(sessionId, failureContent(partial, reason), true);
    } catch (RuntimeException persistenceError) {
      log.error(
          "Failed to persist partial response of stream {} for session {}",
          handle.threadId(),
          sessionId,
          persistenceError);
    }

    if (handle.fail(saved, reason)) {
      eventPublisher.publish(
          new StreamFailed(
              sessionId, handle.threadId(), reason, StringUtils.hasText(partial) ? partial : null));
      telemetry.streamFinished(sessionId, StreamState.FAILED, handle.elapsed());
    }
  }

  String failureContent(String partial, String reason) {
    String marker = properties.getFailureMarker() + ": " + reason;
    if (!StringUtils.hasText(partial)) {
      return marker;
    }
    return partial + "\n\n" + marker;
  }

  private void release(StreamHandle handle) {
    if (handle.release()) {
      activeStreams.remove(handle.sessionId(), handle);
      permits.release();
    }
  }

  private void ensureNotCancelled(StreamHandle handle) {
    if (handle.isCancellationRequested() || Thread.currentThread().isInterrupted()) {
      throw new StreamCancelledException(handle.threadId());
    }
  }

  private SendResult reject(String sessionId, SendRejection rejection) {
    telemetry.streamRejected(sessionId, rejection);
    return SendResult.rejected(rejection);
  }

  private String describe(Throwable error) {
    String message = error.getMessage();
    return StringUtils.hasText(message) ? message : error.getClass().getSimpleName();
  }
}
