package com.aiadvent.chatcore.chat.api;

import com.aiadvent.chatcore.chat.stream.StreamHandle;

public record StreamUpdateEvent(String sessionId, String threadId, String type, String content) {

  public static StreamUpdateEvent replay(StreamHandle handle, String content) {
    return new StreamUpdateEvent(handle.sessionId(), handle.threadId(), "replay", content);
  }

  public static StreamUpdateEvent content(StreamHandle handle, String content) {
    return new StreamUpdateEvent(handle.sessionId(), handle.threadId(), "content", content);
  }

  public static StreamUpdateEvent complete(StreamHandle handle, String content) {
    return new StreamUpdateEvent(handle.sessionId(), handle.threadId(), "complete", content);
  }

  public static StreamUpdateEvent error(StreamHandle handle, String message) {
    return new StreamUpdateEvent(handle.sessionId(), handle.threadId(), "error", message);
  }

  public static StreamUpdateEvent stopped(StreamHandle handle, String content) {
    return new StreamUpdateEvent(handle.sessionId(), handle.threadId(), "stopped", content);
  }
}
