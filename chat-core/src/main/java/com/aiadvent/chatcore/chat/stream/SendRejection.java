package com.aiadvent.chatcore.chat.stream;

public enum SendRejection {
  SESSION_BUSY("Please wait for the current response to complete before asking another question."),
  CAPACITY_EXCEEDED("Too many responses are streaming right now. Please try again shortly."),
  SHUT_DOWN("The chat service is shutting down.");

  private final String userMessage;

  SendRejection(String userMessage) {
    this.userMessage = userMessage;
  }

  public String userMessage() {
    return userMessage;
  }
}
