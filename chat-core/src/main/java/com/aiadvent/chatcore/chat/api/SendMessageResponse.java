package com.aiadvent.chatcore.chat.api;

public record SendMessageResponse(String sessionId, String threadId) {}
