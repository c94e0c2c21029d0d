package com.aiadvent.chatcore.chat.stream;

public enum StreamState {
  CREATED,
  STREAMING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
