package com.aiadvent.chatcore.chat.persistence;

public class ChatSessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public ChatSessionNotFoundException(String sessionId) {
    super("Chat session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public String getSessionId() {
    return sessionId;
  }
}
