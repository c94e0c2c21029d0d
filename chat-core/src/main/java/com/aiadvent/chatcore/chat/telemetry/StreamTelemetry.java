package com.aiadvent.chatcore.chat.telemetry;

import com.aiadvent.chatcore.chat.stream.SendRejection;
import com.aiadvent.chatcore.chat.stream.StreamState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StreamTelemetry {

  private static final Logger log = LoggerFactory.getLogger(StreamTelemetry.class);

  private final MeterRegistry meterRegistry;

  public StreamTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public void bindActiveStreams(Supplier<Number> activeStreams) {
    Gauge.builder("chat.stream.active", activeStreams).register(meterRegistry);
  }

  public void streamAccepted(String sessionId, String threadId) {
    meterRegistry.counter("chat.stream.accepted").increment();
    log.debug("Stream {} accepted for session {}", threadId, sessionId);
  }

  public void streamRejected(String sessionId, SendRejection rejection) {
    meterRegistry.counter("chat.stream.rejected", "reason", tag(rejection)).increment();
    log.warn("Stream request for session {} rejected: {}", sessionId, rejection);
  }

  public void streamFinished(String sessionId, StreamState outcome, Duration duration) {
    String tag = tag(outcome);
    meterRegistry.counter("chat.stream.outcome", "outcome", tag).increment();
    if (duration != null) {
      meterRegistry.timer("chat.stream.duration", "outcome", tag).record(duration);
    }
    log.debug("Stream for session {} finished as {} after {} ms", sessionId, outcome,
        duration != null ? duration.toMillis() : -1);
  }

  public void viewEvicted(String sessionId, String tier) {
    meterRegistry.counter("chat.view.evictions", "tier", tier).increment();
  }

  public MeterRegistry meterRegistry() {
    return meterRegistry;
  }

  private String tag(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
