package com.aiadvent.chatcore.chat.stream.event;

public interface StreamEventPublisher {

  /** Must not throw; listener failures stay on the listener side. */
  void publish(StreamEvent event);
}
