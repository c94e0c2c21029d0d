package com.aiadvent.chatcore.chat.persistence;

import java.util.List;

/**
 * Durable transcript of chat sessions. Calls are blocking and are expected to run off the UI
 * thread.
 */
public interface ChatHistoryStore {

  /**
   * Stores a user message, creating the session on its first message.
   */
  StoredMessage recordUserMessage(String sessionId, String content);

  /**
   * Stores an assistant response. Returns {@code null} when there is nothing to store.
   *
   * @throws ChatSessionNotFoundException if the session has never been recorded
   */
  StoredMessage saveAssistantResponse(String sessionId, String content, boolean failed);

  MessagePage loadLatest(String sessionId, int limit);

  MessagePage loadBefore(String sessionId, int beforeSequence, int limit);

  List<StoredMessage> search(String sessionId, String query, int limit);
}
