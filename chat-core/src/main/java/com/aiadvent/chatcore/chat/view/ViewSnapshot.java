package com.aiadvent.chatcore.chat.view;

import java.util.List;
import java.util.Optional;

/** Immutable picture of a session view, emitted after every change. */
public record ViewSnapshot(
    String sessionId,
    List<ViewMessage> messages,
    boolean hasMoreMessages,
    boolean loading,
    boolean loadingPrevious,
    boolean thinking,
    long thinkingSeconds,
    String streamingResponse,
    String errorMessage,
    boolean searchMode,
    String searchQuery,
    List<ViewMessage> searchResults,
    int searchIndex) {

  public ViewSnapshot {
    messages = messages == null ? List.of() : List.copyOf(messages);
    searchResults = searchResults == null ? List.of() : List.copyOf(searchResults);
  }

  public Optional<ViewMessage> currentSearchResult() {
    if (searchIndex < 0 || searchIndex >= searchResults.size()) {
      return Optional.empty();
    }
    return Optional.of(searchResults.get(searchIndex));
  }
}
