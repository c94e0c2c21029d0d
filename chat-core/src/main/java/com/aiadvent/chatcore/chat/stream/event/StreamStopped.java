package com.aiadvent.chatcore.chat.stream.event;

public record StreamStopped(String sessionId, String threadId, String partialResponse)
    implements StreamEvent {}
