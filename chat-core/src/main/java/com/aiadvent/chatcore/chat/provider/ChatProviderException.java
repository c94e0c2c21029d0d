package com.aiadvent.chatcore.chat.provider;

public class ChatProviderException extends RuntimeException {

  public ChatProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
