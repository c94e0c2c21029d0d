package com.aiadvent.chatcore.chat.stream.event;

public record StreamCompleted(String sessionId, String threadId, String response, long durationMs)
    implements StreamEvent {}
