package com.aiadvent.chatcore.chat.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.chatcore.chat.config.StreamingProperties;
import com.aiadvent.chatcore.chat.domain.ChatRole;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.provider.ChatProviderException;
import com.aiadvent.chatcore.chat.provider.ChatResponder;
import com.aiadvent.chatcore.chat.service.PromptContextService;
import com.aiadvent.chatcore.chat.stream.event.StreamCompleted;
import com.aiadvent.chatcore.chat.stream.event.StreamFailed;
import com.aiadvent.chatcore.chat.stream.event.StreamStarted;
import com.aiadvent.chatcore.chat.stream.event.StreamStopped;
import com.aiadvent.chatcore.chat.support.Await;
import com.aiadvent.chatcore.chat.support.DirectExecutorService;
import com.aiadvent.chatcore.chat.support.InMemoryChatHistoryStore;
import com.aiadvent.chatcore.chat.support.RecordingStreamEventPublisher;
import com.aiadvent.chatcore.chat.support.ScriptedChatResponder;
import com.aiadvent.chatcore.chat.telemetry.StreamTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

class StreamOrchestratorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private InMemoryChatHistoryStore historyStore;
  private RecordingStreamEventPublisher eventPublisher;
  private SimpleMeterRegistry meterRegistry;
  private StreamingProperties properties;
  private ExecutorService executorService;
  private StreamOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    historyStore = new InMemoryChatHistoryStore();
    eventPublisher = new RecordingStreamEventPublisher();
    meterRegistry = new SimpleMeterRegistry();
    properties = new StreamingProperties();
    properties.setShutdownTimeout(Duration.ofSeconds(1));
  }

  @AfterEach
  void tearDown() {
    if (orchestrator != null) {
      orchestrator.shutdown();
    }
    if (executorService != null) {
      executorService.shutdownNow();
    }
    meterRegistry.close();
  }

  @Test
  void acceptedSendRegistersHandleImmediately() {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("Hi");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));

    SendResult result = orchestrator.sendMessage("s1", "hi");

    assertThat(result.isAccepted()).isTrue();
    assertThat(orchestrator.getActiveThread("s1"))
        .map(StreamHandle::threadId)
        .contains(result.threadId());
    assertThat(eventPublisher.eventsOf(StreamStarted.class))
        .singleElement()
        .satisfies(started -> assertThat(started.userMessage()).isEqualTo("hi"));

    responder.openFinish();
    Await.until(() -> !orchestrator.hasActiveStream("s1"), TIMEOUT);
  }

  @Test
  void secondSendForBusySessionIsRejected() {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("Hi");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));

    SendResult first = orchestrator.sendMessage("s1", "hi");
    SendResult second = orchestrator.sendMessage("s1", "again");

    assertThat(first.isAccepted()).isTrue();
    assertThat(second.isAccepted()).isFalse();
    assertThat(second.rejection()).isEqualTo(SendRejection.SESSION_BUSY);
    assertThat(historyStore.messages("s1")).extracting(StoredMessage::content).containsExactly("hi");
    assertThat(meterRegistry.counter("chat.stream.rejected", "reason", "session_busy").count())
        .isEqualTo(1.0d);

    responder.openFinish();
    Await.until(() -> !orchestrator.hasActiveStream("s1"), TIMEOUT);
  }

  @Test
  void subscriberSeesGrowingContentAndResponseIsPersisted() throws InterruptedException {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedStart("Hel", "lo");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));
    List<String> seen = new CopyOnWriteArrayList<>();
    CountDownLatch terminated = new CountDownLatch(1);
    StreamSubscriber subscriber =
        new StreamSubscriber(orchestrator, Schedulers.immediate(), sessionId -> true);

    orchestrator.sendMessage("s1", "hi");
    boolean subscribed =
        subscriber.subscribe(
            "s1",
            new StreamObserver() {
              @Override
              public void onContent(StreamHandle handle, String content) {
                seen.add(content);
              }

              @Override
              public void onTerminated(StreamHandle handle) {
                terminated.countDown();
              }
            });
    responder.openStart();

    assertThat(subscribed).isTrue();
    assertThat(terminated.await(5, TimeUnit.SECONDS)).isTrue();
    Await.until(() -> !orchestrator.hasActiveStream("s1"), TIMEOUT);
    Await.until(() -> !eventPublisher.eventsOf(StreamCompleted.class).isEmpty(), TIMEOUT);

    assertThat(seen).containsExactly("Hel", "Hello");
    assertThat(historyStore.assistantMessages("s1"))
        .singleElement()
        .satisfies(
            message -> {
              assertThat(message.content()).isEqualTo("Hello");
              assertThat(message.failed()).isFalse();
            });
    assertThat(eventPublisher.eventsOf(StreamCompleted.class))
        .singleElement()
        .satisfies(completed -> assertThat(completed.response()).isEqualTo("Hello"));
    assertThat(meterRegistry.counter("chat.stream.outcome", "outcome", "completed").count())
        .isEqualTo(1.0d);
  }

  @Test
  void providerFailurePersistsPartialContentWithMarker() {
    ScriptedChatResponder responder =
        ScriptedChatResponder.failing(
            new ChatProviderException("Model overloaded", null), "par", "tial");
    orchestrator = create(responder, new DirectExecutorService());

    SendResult result = orchestrator.sendMessage("s1", "hi");

    assertThat(result.isAccepted()).isTrue();
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(historyStore.assistantMessages("s1"))
        .singleElement()
        .satisfies(
            message -> {
              assertThat(message.content())
                  .isEqualTo("partial\n\nResponse failed: Model overloaded");
              assertThat(message.failed()).isTrue();
            });
    assertThat(eventPublisher.eventsOf(StreamFailed.class))
        .singleElement()
        .satisfies(
            failed -> {
              assertThat(failed.partialResponse()).isEqualTo("partial");
              assertThat(failed.error()).isEqualTo("Model overloaded");
              assertThat(failed.threadId()).isEqualTo(result.threadId());
            });
    assertThat(eventPublisher.eventsOf(StreamCompleted.class)).isEmpty();
    assertThat(meterRegistry.counter("chat.stream.outcome", "outcome", "failed").count())
        .isEqualTo(1.0d);
  }

  @Test
  void failureBeforeAnyTokenStoresMarkerOnly() {
    ScriptedChatResponder responder =
        ScriptedChatResponder.failing(new ChatProviderException("Connection refused", null));
    orchestrator = create(responder, new DirectExecutorService());

    orchestrator.sendMessage("s1", "hi");

    assertThat(historyStore.assistantMessages("s1"))
        .extracting(StoredMessage::content)
        .containsExactly("Response failed: Connection refused");
    assertThat(eventPublisher.eventsOf(StreamFailed.class))
        .singleElement()
        .satisfies(failed -> assertThat(failed.partialResponse()).isNull());
  }

  @Test
  void failureToPersistPartialResponseStillTerminatesStream() {
    ScriptedChatResponder responder =
        ScriptedChatResponder.failing(new ChatProviderException("boom", null), "par");
    historyStore.failSavingWith(new IllegalStateException("database unavailable"));
    orchestrator = create(responder, new DirectExecutorService());

    orchestrator.sendMessage("s1", "hi");

    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(eventPublisher.eventsOf(StreamFailed.class)).hasSize(1);
    assertThat(orchestrator.sendMessage("s1", "retry").isAccepted()).isTrue();
  }

  @Test
  void userMessageIsRecordedBeforeProviderIsCalled() {
    historyStore.seed("s1", ChatRole.USER, "earlier question");
    historyStore.seed("s1", ChatRole.ASSISTANT, "earlier answer");
    ScriptedChatResponder responder = ScriptedChatResponder.completing("ok");
    orchestrator = create(responder, new DirectExecutorService());

    orchestrator.sendMessage("s1", "hi");

    assertThat(responder.lastPrompt().messages())
        .extracting(StoredMessage::content)
        .containsExactly("earlier question", "earlier answer", "hi");
    assertThat(responder.lastPrompt().latestUserMessage()).isEqualTo("hi");
    assertThat(historyStore.messages("s1"))
        .extracting(StoredMessage::content)
        .containsExactly("earlier question", "earlier answer", "hi", "ok");
  }

  @Test
  void preparationFailureRollsBackRegistration() {
    properties.setMaxConcurrentStreams(1);
    ScriptedChatResponder responder = ScriptedChatResponder.completing("ok");
    historyStore.failRecordingWith(new IllegalStateException("database unavailable"));
    orchestrator = create(responder, new DirectExecutorService());

    assertThatThrownBy(() -> orchestrator.sendMessage("s1", "hi"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("database unavailable");

    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(eventPublisher.eventsOf(StreamStarted.class)).isEmpty();
    assertThat(responder.invocations()).isZero();

    historyStore.failRecordingWith(null);
    assertThat(orchestrator.sendMessage("s2", "hi").isAccepted()).isTrue();
  }

  @Test
  void blankMessageIsRejectedAsInvalidInput() {
    orchestrator = create(ScriptedChatResponder.completing("ok"), new DirectExecutorService());

    assertThatThrownBy(() -> orchestrator.sendMessage("s1", "   "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> orchestrator.sendMessage(" ", "hi"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void concurrentSendsForOneSessionCreateSingleHandle() throws Exception {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("ok");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));
    ExecutorService callers = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Callable<SendResult>> sends = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        sends.add(
            () -> {
              start.await();
              return orchestrator.sendMessage("s1", "hi");
            });
      }
      List<Future<SendResult>> futures = new ArrayList<>();
      for (Callable<SendResult> send : sends) {
        futures.add(callers.submit(send));
      }
      start.countDown();

      List<SendResult> results = new ArrayList<>();
      for (Future<SendResult> future : futures) {
        results.add(future.get(5, TimeUnit.SECONDS));
      }

      assertThat(results).filteredOn(SendResult::isAccepted).hasSize(1);
      assertThat(results)
          .filteredOn(result -> !result.isAccepted())
          .extracting(SendResult::rejection)
          .containsOnly(SendRejection.SESSION_BUSY);
      assertThat(orchestrator.activeStreamCount()).isEqualTo(1);
    } finally {
      callers.shutdownNow();
      responder.openFinish();
    }
    Await.until(() -> orchestrator.activeStreamCount() == 0, TIMEOUT);
  }

  @Test
  void globalBoundLimitsConcurrentStreams() {
    properties.setMaxConcurrentStreams(3);
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("ok");
    orchestrator = create(responder, Executors.newFixedThreadPool(6));

    List<SendResult> results = new ArrayList<>();
    for (int i = 1; i <= 6; i++) {
      results.add(orchestrator.sendMessage("s" + i, "hi"));
    }

    assertThat(results).filteredOn(SendResult::isAccepted).hasSize(3);
    assertThat(results)
        .filteredOn(result -> !result.isAccepted())
        .extracting(SendResult::rejection)
        .containsOnly(SendRejection.CAPACITY_EXCEEDED);
    assertThat(orchestrator.activeStreamCount()).isEqualTo(3);
    assertThat(meterRegistry.get("chat.stream.active").gauge().value()).isEqualTo(3.0d);

    responder.openFinish();
    Await.until(() -> orchestrator.activeStreamCount() == 0, TIMEOUT);
    assertThat(orchestrator.sendMessage("s7", "hi").isAccepted()).isTrue();
  }

  @Test
  void globalBoundHoldsUnderConcurrentSendsFromDistinctSessions() throws Exception {
    properties.setMaxConcurrentStreams(5);
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("ok");
    orchestrator = create(responder, Executors.newFixedThreadPool(5));
    ExecutorService callers = Executors.newFixedThreadPool(50);
    CountDownLatch start = new CountDownLatch(1);
    AtomicBoolean sending = new AtomicBoolean(true);
    AtomicInteger maxActive = new AtomicInteger();
    Thread sampler =
        new Thread(
            () -> {
              while (sending.get()) {
                maxActive.accumulateAndGet(orchestrator.activeStreamCount(), Math::max);
              }
            });
    try {
      List<Future<SendResult>> futures = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        String sessionId = "session-" + i;
        futures.add(
            callers.submit(
                () -> {
                  start.await();
                  return orchestrator.sendMessage(sessionId, "hi");
                }));
      }
      sampler.start();
      start.countDown();

      List<SendResult> results = new ArrayList<>();
      for (Future<SendResult> future : futures) {
        results.add(future.get(5, TimeUnit.SECONDS));
      }
      sending.set(false);
      sampler.join(TimeUnit.SECONDS.toMillis(5));

      assertThat(results).filteredOn(SendResult::isAccepted).hasSize(5);
      assertThat(results)
          .filteredOn(result -> !result.isAccepted())
          .extracting(SendResult::rejection)
          .containsOnly(SendRejection.CAPACITY_EXCEEDED);
      assertThat(maxActive.get()).isLessThanOrEqualTo(5);
      assertThat(orchestrator.activeStreamCount()).isEqualTo(5);
      assertThat(meterRegistry.counter("chat.stream.rejected", "reason", "capacity_exceeded")
              .count())
          .isEqualTo(45.0d);
    } finally {
      sending.set(false);
      callers.shutdownNow();
      responder.openFinish();
    }
    Await.until(() -> orchestrator.activeStreamCount() == 0, TIMEOUT);
  }

  @Test
  void errorThrownByProviderIsPersistedAsFailure() {
    ChatResponder crashing =
        (prompt, onToken) -> {
          onToken.accept("Hel");
          throw new AssertionError("provider crashed");
        };
    orchestrator = create(crashing, new DirectExecutorService());

    SendResult result = orchestrator.sendMessage("s1", "hi");

    assertThat(result.isAccepted()).isTrue();
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(historyStore.assistantMessages("s1"))
        .singleElement()
        .satisfies(
            message -> {
              assertThat(message.failed()).isTrue();
              assertThat(message.content()).isEqualTo("Hel\n\nResponse failed: provider crashed");
            });
    assertThat(eventPublisher.eventsOf(StreamFailed.class))
        .singleElement()
        .satisfies(
            failed -> {
              assertThat(failed.error()).isEqualTo("provider crashed");
              assertThat(failed.partialResponse()).isEqualTo("Hel");
            });
    assertThat(meterRegistry.counter("chat.stream.outcome", "outcome", "failed").count())
        .isEqualTo(1.0d);
  }

  @Test
  void stopDuringPreparationSkipsStartAndProvider() {
    historyStore =
        new InMemoryChatHistoryStore() {
          @Override
          public synchronized StoredMessage recordUserMessage(String sessionId, String content) {
            StoredMessage recorded = super.recordUserMessage(sessionId, content);
            orchestrator.stopStream(sessionId);
            return recorded;
          }
        };
    ScriptedChatResponder responder = ScriptedChatResponder.completing("Hello");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));

    SendResult result = orchestrator.sendMessage("s1", "hi");

    assertThat(result.isAccepted()).isTrue();
    assertThat(eventPublisher.eventsOf(StreamStarted.class)).isEmpty();
    assertThat(eventPublisher.eventsOf(StreamStopped.class))
        .singleElement()
        .satisfies(stopped -> assertThat(stopped.threadId()).isEqualTo(result.threadId()));
    assertThat(responder.invocations()).isZero();
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(historyStore.assistantMessages("s1")).isEmpty();
  }

  @Test
  void stopStreamCancelsOnceAndPersistsNothing() throws InterruptedException {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("Hel");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));

    orchestrator.sendMessage("s1", "hi");
    assertThat(responder.awaitTokens(TIMEOUT)).isTrue();
    StreamHandle handle = orchestrator.getActiveThread("s1").orElseThrow();

    assertThat(orchestrator.stopStream("s1")).isTrue();
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(orchestrator.stopStream("s1")).isFalse();

    executorService.shutdown();
    assertThat(executorService.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    assertThat(handle.isCancelled()).isTrue();
    assertThat(handle.currentContent()).isEqualTo("Hel");
    assertThat(historyStore.assistantMessages("s1")).isEmpty();
    assertThat(eventPublisher.eventsOf(StreamStopped.class))
        .singleElement()
        .satisfies(stopped -> assertThat(stopped.partialResponse()).isEqualTo("Hel"));
    assertThat(eventPublisher.eventsOf(StreamFailed.class)).isEmpty();
    assertThat(eventPublisher.eventsOf(StreamCompleted.class)).isEmpty();
    assertThat(meterRegistry.counter("chat.stream.outcome", "outcome", "cancelled").count())
        .isEqualTo(1.0d);
  }

  @Test
  void stopWithoutActiveStreamIsNoOp() {
    orchestrator = create(ScriptedChatResponder.completing("ok"), new DirectExecutorService());

    assertThat(orchestrator.stopStream("unknown")).isFalse();
    assertThat(eventPublisher.events()).isEmpty();
  }

  @Test
  void sessionCanSendAgainAfterStop() throws InterruptedException {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("Hel");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));

    orchestrator.sendMessage("s1", "hi");
    assertThat(responder.awaitTokens(TIMEOUT)).isTrue();
    orchestrator.stopStream("s1");

    SendResult retry = orchestrator.sendMessage("s1", "hi again");

    assertThat(retry.isAccepted()).isTrue();
    assertThat(orchestrator.getActiveThread("s1"))
        .map(StreamHandle::threadId)
        .contains(retry.threadId());
  }

  @Test
  void shutdownStopsStreamsAndRejectsNewSends() throws InterruptedException {
    ScriptedChatResponder responder = ScriptedChatResponder.gatedFinish("Hel");
    orchestrator = create(responder, Executors.newFixedThreadPool(2));
    orchestrator.sendMessage("s1", "hi");
    assertThat(responder.awaitTokens(TIMEOUT)).isTrue();

    orchestrator.shutdown();

    assertThat(orchestrator.isShutdown()).isTrue();
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(eventPublisher.eventsOf(StreamStopped.class)).hasSize(1);
    assertThat(orchestrator.sendMessage("s2", "hi").rejection())
        .isEqualTo(SendRejection.SHUT_DOWN);
    assertThat(executorService.isShutdown()).isTrue();
  }

  @Test
  void rejectedSubmissionReleasesSlot() {
    properties.setMaxConcurrentStreams(1);
    DirectExecutorService executor = new DirectExecutorService();
    executor.shutdown();
    orchestrator = create(ScriptedChatResponder.completing("ok"), executor);

    SendResult result = orchestrator.sendMessage("s1", "hi");

    assertThat(result.rejection()).isEqualTo(SendRejection.SHUT_DOWN);
    assertThat(orchestrator.hasActiveStream("s1")).isFalse();
    assertThat(orchestrator.activeStreamCount()).isZero();
  }

  @Test
  void failureContentJoinsPartialAndMarker() {
    orchestrator = create(ScriptedChatResponder.completing("ok"), new DirectExecutorService());

    assertThat(orchestrator.failureContent("abc", "boom")).isEqualTo("abc\n\nResponse failed: boom");
    assertThat(orchestrator.failureContent("  ", "boom")).isEqualTo("Response failed: boom");
  }

  private StreamOrchestrator create(ChatResponder responder, ExecutorService executor) {
    this.executorService = executor;
    return new StreamOrchestrator(
        responder,
        new PromptContextService(historyStore, properties),
        historyStore,
        eventPublisher,
        new StreamTelemetry(meterRegistry),
        executor,
        properties);
  }
}
