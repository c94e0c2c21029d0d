package com.aiadvent.chatcore.chat.view;

import com.aiadvent.chatcore.chat.persistence.ChatHistoryStore;
import com.aiadvent.chatcore.chat.stream.StreamOrchestrator;
import reactor.core.scheduler.Scheduler;

public class SessionViewFactory {

  private final StreamOrchestrator orchestrator;
  private final ChatHistoryStore historyStore;
  private final Scheduler ioScheduler;
  private final Scheduler uiScheduler;
  private final Scheduler timerScheduler;
  private final int pageSize;
  private final int searchLimit;

  public SessionViewFactory(
      StreamOrchestrator orchestrator,
      ChatHistoryStore historyStore,
      Scheduler ioScheduler,
      Scheduler uiScheduler,
      Scheduler timerScheduler,
      int pageSize,
      int searchLimit) {
    this.orchestrator = orchestrator;
    this.historyStore = historyStore;
    this.ioScheduler = ioScheduler;
    this.uiScheduler = uiScheduler;
    this.timerScheduler = timerScheduler;
    this.pageSize = pageSize;
    this.searchLimit = searchLimit;
  }

  public SessionViewState create(String sessionId) {
    return new SessionViewState(
        sessionId,
        orchestrator,
        historyStore,
        ioScheduler,
        uiScheduler,
        timerScheduler,
        pageSize,
        searchLimit);
  }
}
