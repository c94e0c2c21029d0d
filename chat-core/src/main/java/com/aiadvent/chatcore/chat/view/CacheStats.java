package com.aiadvent.chatcore.chat.view;

public record CacheStats(int totalCached, int activeCount, int inactiveCount, int maxCapacity) {}
