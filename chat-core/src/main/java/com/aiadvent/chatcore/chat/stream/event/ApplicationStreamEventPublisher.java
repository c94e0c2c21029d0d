package com.aiadvent.chatcore.chat.stream.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

public class ApplicationStreamEventPublisher implements StreamEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(ApplicationStreamEventPublisher.class);

  private final ApplicationEventPublisher delegate;

  public ApplicationStreamEventPublisher(ApplicationEventPublisher delegate) {
    this.delegate = delegate;
  }

  @Override
  public void publish(StreamEvent event) {
    if (event == null) {
      return;
    }
    try {
      delegate.publishEvent(event);
    } catch (RuntimeException ex) {
      log.error(
          "Listener failed for {} of stream {} (session {})",
          event.getClass().getSimpleName(),
          event.threadId(),
          event.sessionId(),
          ex);
    }
  }
}
