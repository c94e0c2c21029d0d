package com.aiadvent.chatcore.chat.stream.event;

/**
 * @param partialResponse content streamed before the failure, or {@code null} when nothing was
 *     produced
 */
public record StreamFailed(String sessionId, String threadId, String error, String partialResponse)
    implements StreamEvent {}
