package com.aiadvent.chatcore.chat.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chat.streaming")
public class StreamingProperties {

  /** Upper bound of responses streaming at the same time across all sessions. */
  @Min(1)
  private int maxConcurrentStreams = 20;

  /** Size of the worker pool that runs production tasks. */
  @Min(1)
  private int workerThreads = 20;

  /** Number of most recent transcript messages sent to the provider with each request. */
  @Min(1)
  private int contextWindow = 20;

  /** Marker appended to the persisted partial content of a failed response. */
  @NotBlank private String failureMarker = "Response failed";

  private Duration shutdownTimeout = Duration.ofSeconds(2);

  public int getMaxConcurrentStreams() {
    return Math.max(1, maxConcurrentStreams);
  }

  public void setMaxConcurrentStreams(int maxConcurrentStreams) {
    this.maxConcurrentStreams = Math.max(1, maxConcurrentStreams);
  }

  public int getWorkerThreads() {
    return Math.max(1, workerThreads);
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = Math.max(1, workerThreads);
  }

  public int getContextWindow() {
    return Math.max(1, contextWindow);
  }

  public void setContextWindow(int contextWindow) {
    this.contextWindow = Math.max(1, contextWindow);
  }

  public String getFailureMarker() {
    return failureMarker;
  }

  public void setFailureMarker(String failureMarker) {
    this.failureMarker = failureMarker;
  }

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    if (shutdownTimeout != null && !shutdownTimeout.isNegative()) {
      this.shutdownTimeout = shutdownTimeout;
    }
  }
}
