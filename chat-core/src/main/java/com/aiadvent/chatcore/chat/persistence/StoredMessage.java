package com.aiadvent.chatcore.chat.persistence;

import com.aiadvent.chatcore.chat.domain.ChatMessage;
import com.aiadvent.chatcore.chat.domain.ChatRole;
import java.time.Instant;
import java.util.UUID;

public record StoredMessage(
    UUID id,
    String sessionId,
    ChatRole role,
    String content,
    boolean failed,
    int sequenceNumber,
    Instant createdAt) {

  public static StoredMessage from(ChatMessage message) {
    return new StoredMessage(
        message.getId(),
        message.getSession().getId(),
        message.getRole(),
        message.getContent(),
        message.isFailed(),
        message.getSequenceNumber(),
        message.getCreatedAt());
  }

  public boolean isUser() {
    return role == ChatRole.USER;
  }
}
