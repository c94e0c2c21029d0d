package com.aiadvent.chatcore.chat.view;

import com.aiadvent.chatcore.chat.domain.ChatRole;
import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import java.time.Instant;
import java.util.UUID;

/**
 * Transcript entry as shown to the user. The assistant entry that is still streaming has no id;
 * a user entry that is not yet persisted gets a local id and no sequence number.
 */
public record ViewMessage(
    UUID id,
    ChatRole role,
    String content,
    boolean failed,
    Integer sequenceNumber,
    Instant createdAt) {

  public static ViewMessage from(StoredMessage message) {
    return new ViewMessage(
        message.id(),
        message.role(),
        message.content(),
        message.failed(),
        message.sequenceNumber(),
        message.createdAt());
  }

  static ViewMessage pendingUser(String content) {
    return new ViewMessage(UUID.randomUUID(), ChatRole.USER, content, false, null, Instant.now());
  }

  static ViewMessage streaming(String content) {
    return new ViewMessage(null, ChatRole.ASSISTANT, content, false, null, Instant.now());
  }

  static ViewMessage failedLocal(String content) {
    return new ViewMessage(UUID.randomUUID(), ChatRole.ASSISTANT, content, true, null, Instant.now());
  }

  public boolean isUser() {
    return role == ChatRole.USER;
  }

  public boolean isStreaming() {
    return id == null && !isUser();
  }
}
