package com.aiadvent.chatcore.chat.provider;

import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import java.util.List;

/** Conversation window sent to a provider, oldest message first. */
public record ChatPrompt(String sessionId, List<StoredMessage> messages) {

  public ChatPrompt {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public String latestUserMessage() {
    for (int i = messages.size() - 1; i >= 0; i--) {
      StoredMessage message = messages.get(i);
      if (message.isUser()) {
        return message.content();
      }
    }
    return null;
  }
}
