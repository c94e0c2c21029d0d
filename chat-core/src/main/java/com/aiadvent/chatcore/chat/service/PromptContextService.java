package com.aiadvent.chatcore.chat.service;

import com.aiadvent.chatcore.chat.config.StreamingProperties;
import com.aiadvent.chatcore.chat.persistence.ChatHistoryStore;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.provider.ChatPrompt;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Records the outgoing user message and assembles the conversation window sent to the provider.
 * Failed assistant entries are left out of the window.
 */
@Service
public class PromptContextService {

  private final ChatHistoryStore historyStore;
  private final StreamingProperties properties;

  public PromptContextService(ChatHistoryStore historyStore, StreamingProperties properties) {
    this.historyStore = historyStore;
    this.properties = properties;
  }

  public ChatPrompt prepare(String sessionId, String userMessage) {
    historyStore.recordUserMessage(sessionId, userMessage);
    List<StoredMessage> window =
        historyStore.loadLatest(sessionId, properties.getContextWindow()).messages().stream()
            .filter(message -> !message.failed())
            .toList();
    return new ChatPrompt(sessionId, window);
  }
}
