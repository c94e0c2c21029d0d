package com.aiadvent.chatcore.chat.stream.event;

public record StreamStarted(String sessionId, String threadId, String userMessage)
    implements StreamEvent {}
