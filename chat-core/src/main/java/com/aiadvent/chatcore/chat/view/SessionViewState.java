package com.aiadvent.chatcore.chat.view;

import com.aiadvent.chatcore.chat.persistence.ChatHistoryStore;
import com.aiadvent.chatcore.chat.persistence.MessagePage;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.stream.SendResult;
import com.aiadvent.chatcore.chat.stream.StreamHandle;
import com.aiadvent.chatcore.chat.stream.StreamObserver;
import com.aiadvent.chatcore.chat.stream.StreamOrchestrator;
import com.aiadvent.chatcore.chat.stream.StreamSubscriber;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Per-session state behind a chat screen: the loaded messages, paging, search, the thinking
 * indicator and the live view of a running response.
 *
 * <p>Storage and orchestrator calls run on the I/O scheduler and their results are applied on the
 * UI scheduler. Every change emits a new {@link ViewSnapshot} through {@link #updates()}.
 */
public class SessionViewState {

  private static final Logger log = LoggerFactory.getLogger(SessionViewState.class);

  static final String INTERRUPTED_MESSAGE = "Response was interrupted. Please retry.";

  private final String sessionId;
  private final StreamOrchestrator orchestrator;
  private final ChatHistoryStore historyStore;
  private final Scheduler ioScheduler;
  private final Scheduler uiScheduler;
  private final Scheduler timerScheduler;
  private final int pageSize;
  private final int searchLimit;

  private final StreamSubscriber subscriber;
  private final StreamObserver streamObserver = new ResponseObserver();
  private final AtomicReference<String> currentSessionId = new AtomicReference<>();
  private final Disposable.Composite tasks = Disposables.composite();
  private final Sinks.Many<ViewSnapshot> snapshots = Sinks.many().replay().latest();

  private final List<ViewMessage> messages = new ArrayList<>();
  private Integer oldestSequence;
  private boolean hasMoreMessages;
  private boolean loading;
  private boolean loadingPrevious;
  private boolean thinking;
  private long thinkingSeconds;
  private Disposable thinkingTimer;
  private String streamingResponse;
  private String errorMessage;
  private boolean searchMode;
  private String searchQuery;
  private List<ViewMessage> searchResults = List.of();
  private int searchIndex = -1;
  private volatile boolean cleanedUp;

  public SessionViewState(
      String sessionId,
      StreamOrchestrator orchestrator,
      ChatHistoryStore historyStore,
      Scheduler ioScheduler,
      Scheduler uiScheduler,
      Scheduler timerScheduler,
      int pageSize,
      int searchLimit) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.orchestrator = orchestrator;
    this.historyStore = historyStore;
    this.ioScheduler = ioScheduler;
    this.uiScheduler = uiScheduler;
    this.timerScheduler = timerScheduler;
    this.pageSize = Math.max(1, pageSize);
    this.searchLimit = Math.max(1, searchLimit);
    this.subscriber = new StreamSubscriber(orchestrator, uiScheduler, this::isObservingSession);
    publish();
  }

  public String sessionId() {
    return sessionId;
  }

  public Flux<ViewSnapshot> updates() {
    return snapshots.asFlux();
  }

  public synchronized ViewSnapshot snapshot() {
    return buildSnapshot();
  }

  /** Whether a consumer currently shows this session. */
  public boolean isObserving() {
    return isObservingSession(sessionId);
  }

  public boolean isStreaming() {
    return orchestrator.hasActiveStream(sessionId);
  }

  public boolean isCleanedUp() {
    return cleanedUp;
  }

  /**
   * Reloads the latest page and reattaches to a running response. A trailing user message with
   * no response and no running stream gets a persisted "interrupted" entry.
   */
  public void resume() {
    if (cleanedUp) {
      return;
    }
    currentSessionId.set(sessionId);
    subscriber.unsubscribeAll();
    synchronized (this) {
      resetSearch();
      loading = true;
      errorMessage = null;
      publish();
    }
    runAsync(
        this::loadLatestWithRecovery,
        this::applyLatestPage,
        error -> onLoadFailed("load messages", error));
  }

  /** Shows an empty transcript for a session that has no history yet. */
  public void startFresh() {
    if (cleanedUp) {
      return;
    }
    currentSessionId.set(sessionId);
    subscriber.unsubscribeAll();
    synchronized (this) {
      messages.clear();
      oldestSequence = null;
      hasMoreMessages = false;
      loading = false;
      errorMessage = null;
      streamingResponse = null;
      resetSearch();
      stopThinking();
      publish();
    }
  }

  /** Returns {@code false} when the text is blank or a response is already in progress. */
  public boolean sendMessage(String text) {
    if (cleanedUp || !StringUtils.hasText(text)) {
      return false;
    }
    String message = text.trim();
    ViewMessage pending = ViewMessage.pendingUser(message);
    synchronized (this) {
      if (loading) {
        return false;
      }
      currentSessionId.set(sessionId);
      messages.add(pending);
      trimToLastPage();
      loading = true;
      errorMessage = null;
      streamingResponse = null;
      startThinking();
      publish();
    }
    runAsync(
        () -> orchestrator.sendMessage(sessionId, message),
        result -> onSendResult(result, pending),
        error -> onSendFailed(error, pending));
    return true;
  }

  /** Stops the running response. Content streamed so far stays on screen. */
  public void cancelResponse() {
    subscriber.unsubscribe(sessionId);
    orchestrator.stopStream(sessionId);
    synchronized (this) {
      stopThinking();
      loading = false;
      streamingResponse = null;
      publish();
    }
  }

  /** Loads the page before the oldest loaded message. Returns {@code false} when there is none. */
  public boolean loadPreviousMessages() {
    Integer cursor;
    synchronized (this) {
      if (cleanedUp || loadingPrevious || !hasMoreMessages || oldestSequence == null) {
        return false;
      }
      cursor = oldestSequence;
      loadingPrevious = true;
      publish();
    }
    runAsync(
        () -> historyStore.loadBefore(sessionId, cursor, pageSize),
        this::prependPage,
        error -> onLoadFailed("load earlier messages", error));
    return true;
  }

  public void searchMessages(String query) {
    if (cleanedUp) {
      return;
    }
    if (!StringUtils.hasText(query)) {
      clearSearch();
      return;
    }
    String trimmed = query.trim();
    synchronized (this) {
      searchMode = true;
      searchQuery = trimmed;
      searchResults = List.of();
      searchIndex = -1;
      publish();
    }
    runAsync(
        () -> historyStore.search(sessionId, trimmed, searchLimit),
        results -> applySearchResults(trimmed, results),
        error -> onLoadFailed("search messages", error));
  }

  public synchronized void nextSearchResult() {
    if (searchResults.isEmpty()) {
      return;
    }
    searchIndex = (searchIndex + 1) % searchResults.size();
    publish();
  }

  public synchronized void previousSearchResult() {
    if (searchResults.isEmpty()) {
      return;
    }
    searchIndex = (searchIndex - 1 + searchResults.size()) % searchResults.size();
    publish();
  }

  public synchronized void clearSearch() {
    resetSearch();
    publish();
  }

  /**
   * Switches the consumer away to a new chat. Any running response keeps streaming without this
   * view and is picked up again by {@link #resume()}.
   */
  public void clearChat() {
    currentSessionId.set(null);
    subscriber.unsubscribeAll();
    synchronized (this) {
      stopThinking();
      messages.clear();
      oldestSequence = null;
      hasMoreMessages = false;
      loading = false;
      loadingPrevious = false;
      streamingResponse = null;
      errorMessage = null;
      resetSearch();
      publish();
    }
  }

  /** Releases subscriptions, timers and pending work. The state is unusable afterwards. */
  public void cleanup() {
    if (cleanedUp) {
      return;
    }
    cleanedUp = true;
    currentSessionId.set(null);
    subscriber.unsubscribeAll();
    tasks.dispose();
    synchronized (this) {
      stopThinking();
      messages.clear();
      searchResults = List.of();
      Sinks.EmitResult result = snapshots.tryEmitComplete();
      if (result.isFailure()) {
        log.debug("Snapshot updates of session {} already closed: {}", sessionId, result);
      }
    }
    log.debug("Cleaned up view state of session {}", sessionId);
  }

  private MessagePage loadLatestWithRecovery() {
    MessagePage page = historyStore.loadLatest(sessionId, pageSize);
    if (!endsUnanswered(page) || orchestrator.hasActiveStream(sessionId)) {
      return page;
    }
    // a stream saves its response before releasing the session, so reload once it is gone
    page = historyStore.loadLatest(sessionId, pageSize);
    if (!endsUnanswered(page)) {
      return page;
    }
    StoredMessage last = page.messages().get(page.messages().size() - 1);
    StoredMessage interrupted =
        historyStore.saveAssistantResponse(sessionId, INTERRUPTED_MESSAGE, true);
    if (interrupted == null) {
      return page;
    }
    log.info("Marked unanswered message {} of session {} as interrupted", last.id(), sessionId);
    List<StoredMessage> recovered = new ArrayList<>(page.messages());
    recovered.add(interrupted);
    return new MessagePage(recovered, page.nextCursor(), page.hasMore());
  }

  private boolean endsUnanswered(MessagePage page) {
    if (page.isEmpty() || page.hasMore()) {
      return false;
    }
    return page.messages().get(page.messages().size() - 1).isUser();
  }

  private void applyLatestPage(MessagePage page) {
    boolean streaming = orchestrator.hasActiveStream(sessionId);
    synchronized (this) {
      messages.clear();
      for (StoredMessage message : page.messages()) {
        messages.add(ViewMessage.from(message));
      }
      oldestSequence = page.nextCursor();
      hasMoreMessages = page.hasMore();
      loading = streaming;
      if (streaming) {
        startThinking();
      } else {
        stopThinking();
      }
      publish();
    }
    if (streaming) {
      attachToStream();
    }
  }

  private void refreshLatest() {
    runAsync(
        () -> historyStore.loadLatest(sessionId, pageSize),
        this::applyLatestPage,
        error -> onLoadFailed("load messages", error));
  }

  private void attachToStream() {
    if (!subscriber.subscribe(sessionId, streamObserver)) {
      refreshLatest();
    }
  }

  private synchronized void prependPage(MessagePage page) {
    List<ViewMessage> older = new ArrayList<>(page.messages().size());
    for (StoredMessage message : page.messages()) {
      older.add(ViewMessage.from(message));
    }
    messages.addAll(0, older);
    if (page.nextCursor() != null) {
      oldestSequence = page.nextCursor();
    }
    hasMoreMessages = page.hasMore();
    loadingPrevious = false;
    publish();
  }

  private synchronized void applySearchResults(String query, List<StoredMessage> results) {
    if (!searchMode || !query.equals(searchQuery)) {
      return;
    }
    List<ViewMessage> found = new ArrayList<>(results.size());
    for (StoredMessage message : results) {
      found.add(ViewMessage.from(message));
    }
    searchResults = List.copyOf(found);
    searchIndex = found.isEmpty() ? -1 : 0;
    publish();
  }

  private void onSendResult(SendResult result, ViewMessage pending) {
    if (result.isAccepted()) {
      attachToStream();
      return;
    }
    synchronized (this) {
      messages.remove(pending);
      stopThinking();
      loading = false;
      errorMessage = result.rejection().userMessage();
      publish();
    }
  }

  private void onSendFailed(Throwable error, ViewMessage pending) {
    log.error("Failed to send message for session {}", sessionId, error);
    synchronized (this) {
      messages.remove(pending);
      stopThinking();
      loading = false;
      errorMessage = "Failed to send message: " + describe(error);
      publish();
    }
  }

  private void onLoadFailed(String action, Throwable error) {
    log.error("Failed to {} for session {}", action, sessionId, error);
    synchronized (this) {
      loading = false;
      loadingPrevious = false;
      stopThinking();
      errorMessage = "Failed to " + action + ": " + describe(error);
      publish();
    }
  }

  private synchronized void onStreamContent(String content) {
    stopThinking();
    streamingResponse = content;
    ViewMessage streaming = ViewMessage.streaming(content);
    int last = messages.size() - 1;
    if (last >= 0 && messages.get(last).isStreaming()) {
      messages.set(last, streaming);
    } else {
      messages.add(streaming);
    }
    publish();
  }

  private synchronized void onStreamTerminated(StreamHandle handle) {
    stopThinking();
    loading = false;
    streamingResponse = null;
    int last = messages.size() - 1;
    boolean hasStreamingEntry = last >= 0 && messages.get(last).isStreaming();
    // a cancelled response keeps its partial entry unfinalized
    if (handle.isComplete() || handle.hasFailed()) {
      ViewMessage finalized = handle.savedMessage().map(ViewMessage::from).orElse(null);
      if (finalized == null && handle.hasFailed()) {
        finalized = ViewMessage.failedLocal(handle.error().orElse("Response failed"));
      }
      if (hasStreamingEntry) {
        messages.remove(last);
      }
      if (finalized != null) {
        messages.add(finalized);
      }
      if (handle.hasFailed()) {
        errorMessage = handle.error().orElse(null);
      }
    }
    publish();
  }

  private void trimToLastPage() {
    if (messages.size() <= pageSize * 2) {
      return;
    }
    messages.subList(0, messages.size() - pageSize).clear();
    hasMoreMessages = true;
    oldestSequence =
        messages.stream()
            .map(ViewMessage::sequenceNumber)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(oldestSequence);
  }

  private void startThinking() {
    stopThinking();
    thinking = true;
    thinkingSeconds = 0;
    thinkingTimer =
        Flux.interval(Duration.ofSeconds(1), timerScheduler)
            .publishOn(uiScheduler)
            .subscribe(
                tick -> onThinkingTick(tick + 1),
                error -> log.warn("Thinking timer of session {} stopped", sessionId, error));
  }

  private synchronized void onThinkingTick(long seconds) {
    if (!thinking) {
      return;
    }
    thinkingSeconds = seconds;
    publish();
  }

  private void stopThinking() {
    thinking = false;
    thinkingSeconds = 0;
    if (thinkingTimer != null) {
      thinkingTimer.dispose();
      thinkingTimer = null;
    }
  }

  private void resetSearch() {
    searchMode = false;
    searchQuery = null;
    searchResults = List.of();
    searchIndex = -1;
  }

  private boolean isObservingSession(String candidate) {
    return !cleanedUp && candidate != null && candidate.equals(currentSessionId.get());
  }

  /** Runs the call on the I/O scheduler and hands its result to the UI scheduler. */
  private <T> void runAsync(
      Callable<T> call, Consumer<T> onResult, Consumer<Throwable> onError) {
    Disposable.Swap slot = Disposables.swap();
    if (!tasks.add(slot)) {
      return;
    }
    Disposable task =
        Mono.fromCallable(call)
            .subscribeOn(ioScheduler)
            .publishOn(uiScheduler)
            .doFinally(signal -> tasks.remove(slot))
            .subscribe(onResult, onError);
    slot.update(task);
  }

  private void publish() {
    if (cleanedUp) {
      return;
    }
    Sinks.EmitResult result = snapshots.tryEmitNext(buildSnapshot());
    if (result.isFailure()) {
      log.debug("Dropped snapshot for session {}: {}", sessionId, result);
    }
  }

  private ViewSnapshot buildSnapshot() {
    return new ViewSnapshot(
        sessionId,
        messages,
        hasMoreMessages,
        loading,
        loadingPrevious,
        thinking,
        thinkingSeconds,
        streamingResponse,
        errorMessage,
        searchMode,
        searchQuery,
        searchResults,
        searchIndex);
  }

  private String describe(Throwable error) {
    String message = error.getMessage();
    return StringUtils.hasText(message) ? message : error.getClass().getSimpleName();
  }

  private final class ResponseObserver implements StreamObserver {

    @Override
    public void onContent(StreamHandle handle, String content) {
      onStreamContent(content);
    }

    @Override
    public void onTerminated(StreamHandle handle) {
      onStreamTerminated(handle);
    }
  }
}
