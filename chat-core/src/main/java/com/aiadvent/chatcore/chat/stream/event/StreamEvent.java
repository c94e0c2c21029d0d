package com.aiadvent.chatcore.chat.stream.event;

/** Lifecycle notification for one stream. */
public interface StreamEvent {

  String sessionId();

  String threadId();
}
