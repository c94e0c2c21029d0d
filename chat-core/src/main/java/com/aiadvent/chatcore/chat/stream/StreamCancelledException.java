package com.aiadvent.chatcore.chat.stream;

/** Raised inside the production task once the stream has been stopped. */
public class StreamCancelledException extends RuntimeException {

  private final String threadId;

  public StreamCancelledException(String threadId) {
    super("Stream " + threadId + " was cancelled");
    this.threadId = threadId;
  }

  public String getThreadId() {
    return threadId;
  }
}
