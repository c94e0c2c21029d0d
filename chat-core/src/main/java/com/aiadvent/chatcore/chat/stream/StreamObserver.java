package com.aiadvent.chatcore.chat.stream;

/**
 * Callbacks for one consumer watching one session's stream. Every callback receives the handle
 * the subscription is attached to.
 */
public interface StreamObserver {

  /** Content accumulated before the observer attached. */
  default void onReplay(StreamHandle handle, String content) {
    onContent(handle, content);
  }

  /** Full content so far; each call carries a strictly longer text than the previous one. */
  void onContent(StreamHandle handle, String content);

  /** The stream reached a terminal state. Inspect the handle for the outcome. */
  void onTerminated(StreamHandle handle);
}
