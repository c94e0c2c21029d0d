package com.aiadvent.chatcore.chat.api;

import jakarta.validation.constraints.NotBlank;

public record SendMessageRequest(@NotBlank(message = "Message must not be empty") String message) {}
