package com.aiadvent.chatcore.chat.config;

import com.aiadvent.chatcore.chat.view.EvictionFallback;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chat.view-cache")
public class ViewCacheProperties {

  /** Number of per-session view states kept in memory. */
  @Min(1)
  private int capacity = 20;

  /** Messages loaded per page when a session is resumed or scrolled back. */
  @Min(1)
  private int pageSize = 100;

  @Min(1)
  private int searchLimit = 100;

  /**
   * What to do when the cache is full and every entry is either the active session or backs a
   * running stream.
   */
  @NotNull private EvictionFallback evictionFallback = EvictionFallback.OVERFLOW;

  public int getCapacity() {
    return Math.max(1, capacity);
  }

  public void setCapacity(int capacity) {
    this.capacity = Math.max(1, capacity);
  }

  public int getPageSize() {
    return Math.max(1, pageSize);
  }

  public void setPageSize(int pageSize) {
    this.pageSize = Math.max(1, pageSize);
  }

  public int getSearchLimit() {
    return Math.max(1, searchLimit);
  }

  public void setSearchLimit(int searchLimit) {
    this.searchLimit = Math.max(1, searchLimit);
  }

  public EvictionFallback getEvictionFallback() {
    return evictionFallback;
  }

  public void setEvictionFallback(EvictionFallback evictionFallback) {
    this.evictionFallback = evictionFallback;
  }
}
