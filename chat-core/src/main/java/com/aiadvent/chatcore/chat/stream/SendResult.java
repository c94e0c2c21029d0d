package com.aiadvent.chatcore.chat.stream;

import java.util.Objects;

/** Outcome of a send: the thread id of the new stream, or the reason it was refused. */
public record SendResult(String threadId, SendRejection rejection) {

  public SendResult {
    if ((threadId == null) == (rejection == null)) {
      throw new IllegalArgumentException("Exactly one of threadId and rejection must be set");
    }
  }

  public static SendResult accepted(String threadId) {
    return new SendResult(Objects.requireNonNull(threadId, "threadId"), null);
  }

  public static SendResult rejected(SendRejection rejection) {
    return new SendResult(null, Objects.requireNonNull(rejection, "rejection"));
  }

  public boolean isAccepted() {
    return threadId != null;
  }
}
