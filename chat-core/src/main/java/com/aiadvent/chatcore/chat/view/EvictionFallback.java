package com.aiadvent.chatcore.chat.view;

/** Behaviour of a full cache whose entries are all the active session or mid-stream. */
public enum EvictionFallback {
  /** Keep every entry and let the cache exceed its capacity until a safe entry exists. */
  OVERFLOW,
  /** Evict the oldest non-active entry; its stream keeps running without a view. */
  EVICT_OLDEST
}
