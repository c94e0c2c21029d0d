package com.aiadvent.chatcore.chat.config;

import com.aiadvent.chatcore.chat.persistence.ChatHistoryStore;
import com.aiadvent.chatcore.chat.provider.ChatResponder;
import com.aiadvent.chatcore.chat.provider.SpringAiChatResponder;
import com.aiadvent.chatcore.chat.service.PromptContextService;
import com.aiadvent.chatcore.chat.stream.StreamOrchestrator;
import com.aiadvent.chatcore.chat.stream.event.ApplicationStreamEventPublisher;
import com.aiadvent.chatcore.chat.stream.event.StreamEventPublisher;
import com.aiadvent.chatcore.chat.telemetry.StreamTelemetry;
import com.aiadvent.chatcore.chat.view.SessionViewCache;
import com.aiadvent.chatcore.chat.view.SessionViewFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
@EnableConfigurationProperties({StreamingProperties.class, ViewCacheProperties.class})
public class StreamingConfiguration {

  @Bean(name = "chatStreamExecutor", destroyMethod = "shutdown")
  public ExecutorService chatStreamExecutor(StreamingProperties properties) {
    int threads = properties.getWorkerThreads();
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("chat-stream-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    return Executors.newFixedThreadPool(threads, threadFactory);
  }

  @Bean(name = "chatViewScheduler", destroyMethod = "dispose")
  public Scheduler chatViewScheduler() {
    return Schedulers.newSingle("chat-view", true);
  }

  @Bean
  public StreamTelemetry streamTelemetry(ObjectProvider<MeterRegistry> meterRegistry) {
    return new StreamTelemetry(meterRegistry.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean(ChatResponder.class)
  public ChatResponder chatResponder(ChatModel chatModel) {
    return new SpringAiChatResponder(chatModel);
  }

  @Bean
  @ConditionalOnMissingBean(StreamEventPublisher.class)
  public StreamEventPublisher streamEventPublisher(ApplicationEventPublisher publisher) {
    return new ApplicationStreamEventPublisher(publisher);
  }

  @Bean(destroyMethod = "shutdown")
  public StreamOrchestrator streamOrchestrator(
      ChatResponder chatResponder,
      PromptContextService promptContextService,
      ChatHistoryStore chatHistoryStore,
      StreamEventPublisher streamEventPublisher,
      StreamTelemetry streamTelemetry,
      @Qualifier("chatStreamExecutor") ExecutorService chatStreamExecutor,
      StreamingProperties properties) {
    return new StreamOrchestrator(
        chatResponder,
        promptContextService,
        chatHistoryStore,
        streamEventPublisher,
        streamTelemetry,
        chatStreamExecutor,
        properties);
  }

  @Bean
  public SessionViewFactory sessionViewFactory(
      StreamOrchestrator streamOrchestrator,
      ChatHistoryStore chatHistoryStore,
      @Qualifier("chatViewScheduler") Scheduler chatViewScheduler,
      ViewCacheProperties properties) {
    return new SessionViewFactory(
        streamOrchestrator,
        chatHistoryStore,
        Schedulers.boundedElastic(),
        chatViewScheduler,
        Schedulers.parallel(),
        properties.getPageSize(),
        properties.getSearchLimit());
  }

  @Bean(destroyMethod = "shutdown")
  public SessionViewCache sessionViewCache(
      SessionViewFactory sessionViewFactory,
      StreamOrchestrator streamOrchestrator,
      StreamTelemetry streamTelemetry,
      ViewCacheProperties properties) {
    return new SessionViewCache(
        sessionViewFactory,
        streamOrchestrator,
        streamTelemetry,
        properties.getCapacity(),
        properties.getEvictionFallback());
  }
}
