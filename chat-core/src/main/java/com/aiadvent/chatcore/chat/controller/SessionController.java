package com.aiadvent.chatcore.chat.controller;

import com.aiadvent.chatcore.chat.api.ActiveStreamResponse;
import com.aiadvent.chatcore.chat.api.SendMessageRequest;
import com.aiadvent.chatcore.chat.api.SendMessageResponse;
import com.aiadvent.chatcore.chat.api.StreamUpdateEvent;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.stream.SendRejection;
import com.aiadvent.chatcore.chat.stream.SendResult;
import com.aiadvent.chatcore.chat.stream.StreamHandle;
import com.aiadvent.chatcore.chat.stream.StreamObserver;
import com.aiadvent.chatcore.chat.stream.StreamOrchestrator;
import com.aiadvent.chatcore.chat.stream.StreamSubscriber;
import com.aiadvent.chatcore.chat.view.CacheStats;
import com.aiadvent.chatcore.chat.view.SessionViewCache;
import com.aiadvent.chatcore.chat.view.SessionViewState;
import com.aiadvent.chatcore.chat.view.ViewSnapshot;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/sessions")
@Validated
@Slf4j
public class SessionController {

  private final StreamOrchestrator orchestrator;
  private final SessionViewCache viewCache;

  public SessionController(StreamOrchestrator orchestrator, SessionViewCache viewCache) {
    this.orchestrator = orchestrator;
    this.viewCache = viewCache;
  }

  @PostMapping
  public ResponseEntity<ViewSnapshot> createSession() {
    String sessionId = UUID.randomUUID().toString();
    ViewSnapshot snapshot = viewCache.createNewSession(sessionId).snapshot();
    return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
  }

  @PostMapping(value = "/{sessionId}/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<SendMessageResponse> sendMessage(
      @PathVariable String sessionId, @RequestBody @Valid SendMessageRequest request) {
    SendResult result;
    try {
      result = orchestrator.sendMessage(sessionId, request.message());
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
    }
    if (!result.isAccepted()) {
      SendRejection rejection = result.rejection();
      throw new ResponseStatusException(statusFor(rejection), rejection.userMessage());
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new SendMessageResponse(sessionId, result.threadId()));
  }

  @DeleteMapping("/{sessionId}/stream")
  public ResponseEntity<Void> stopStream(@PathVariable String sessionId) {
    if (!orchestrator.stopStream(sessionId)) {
      throw new ResponseStatusException(
          HttpStatus.NOT_FOUND, "No active stream for session " + sessionId);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{sessionId}/stream/status")
  public ActiveStreamResponse streamStatus(@PathVariable String sessionId) {
    return orchestrator
        .getActiveThread(sessionId)
        .map(ActiveStreamResponse::from)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "No active stream for session " + sessionId));
  }

  @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter attach(@PathVariable String sessionId) {
    SseEmitter emitter = new SseEmitter(0L);
    AtomicBoolean closed = new AtomicBoolean();
    StreamSubscriber subscriber =
        new StreamSubscriber(orchestrator, Schedulers.boundedElastic(), id -> !closed.get());

    Runnable detach =
        () -> {
          closed.set(true);
          subscriber.unsubscribeAll();
        };
    emitter.onCompletion(detach);
    emitter.onTimeout(detach);
    emitter.onError(error -> detach.run());

    boolean attached =
        subscriber.subscribe(
            sessionId,
            new StreamObserver() {
              @Override
              public void onReplay(StreamHandle handle, String content) {
                emit(emitter, StreamUpdateEvent.replay(handle, content));
              }

              @Override
              public void onContent(StreamHandle handle, String content) {
                emit(emitter, StreamUpdateEvent.content(handle, content));
              }

              @Override
              public void onTerminated(StreamHandle handle) {
                emit(emitter, terminalEvent(handle));
                emitter.complete();
              }
            });
    if (!attached) {
      closed.set(true);
      throw new ResponseStatusException(
          HttpStatus.NOT_FOUND, "No active stream for session " + sessionId);
    }
    log.debug("SSE consumer attached to session {}", sessionId);
    return emitter;
  }

  @PostMapping("/{sessionId}/activate")
  public ViewSnapshot activate(@PathVariable String sessionId) {
    return viewCache.switchToSession(sessionId).snapshot();
  }

  @GetMapping("/{sessionId}/view")
  public ViewSnapshot view(@PathVariable String sessionId) {
    return viewCache
        .get(sessionId)
        .map(SessionViewState::snapshot)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Session " + sessionId + " is not cached"));
  }

  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
    viewCache.closeSession(sessionId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/cache")
  public CacheStats cacheStats() {
    return viewCache.stats();
  }

  private StreamUpdateEvent terminalEvent(StreamHandle handle) {
    if (handle.isComplete()) {
      String content =
          handle.savedMessage().map(StoredMessage::content).orElse(handle.currentContent());
      return StreamUpdateEvent.complete(handle, content);
    }
    if (handle.hasFailed()) {
      return StreamUpdateEvent.error(handle, handle.error().orElse("Response failed"));
    }
    return StreamUpdateEvent.stopped(handle, handle.currentContent());
  }

  private HttpStatus statusFor(SendRejection rejection) {
    return switch (rejection) {
      case SESSION_BUSY -> HttpStatus.CONFLICT;
      case CAPACITY_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
      case SHUT_DOWN -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }

  private void emit(SseEmitter emitter, StreamUpdateEvent payload) {
    try {
      emitter.send(SseEmitter.event().name(payload.type()).data(payload));
    } catch (IOException ioException) {
      log.error(
          "Failed to send SSE event {} for session {}",
          payload.type(),
          payload.sessionId(),
          ioException);
      emitter.completeWithError(ioException);
    }
  }
}
