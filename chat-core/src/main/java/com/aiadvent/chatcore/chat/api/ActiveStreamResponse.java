package com.aiadvent.chatcore.chat.api;

import com.aiadvent.chatcore.chat.stream.StreamHandle;
import com.aiadvent.chatcore.chat.stream.StreamState;
import java.time.Instant;

public record ActiveStreamResponse(
    String sessionId, String threadId, StreamState state, String content, Instant startedAt) {

  public static ActiveStreamResponse from(StreamHandle handle) {
    return new ActiveStreamResponse(
        handle.sessionId(),
        handle.threadId(),
        handle.state(),
        handle.currentContent(),
        handle.startedAt());
  }
}
