package com.aiadvent.chatcore.chat.domain;

public enum ChatRole {
  USER,
  ASSISTANT
}
