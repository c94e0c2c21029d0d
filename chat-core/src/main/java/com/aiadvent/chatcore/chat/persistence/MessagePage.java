package com.aiadvent.chatcore.chat.persistence;

import java.util.List;

/**
 * One page of a transcript in ascending sequence order.
 *
 * @param nextCursor sequence number to pass to {@link ChatHistoryStore#loadBefore} for the next
 *     older page, or {@code null} when the page is empty
 */
public record MessagePage(List<StoredMessage> messages, Integer nextCursor, boolean hasMore) {

  public MessagePage {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static MessagePage empty() {
    return new MessagePage(List.of(), null, false);
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}
