package com.scholary.videodigest.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for streamed responses.
 *
 * <p>Summaries are written by a bounded pool so slow generation streams do not hold servlet
 * threads. The timeout covers a whole summary.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "streamingExecutor")
  public ThreadPoolTaskExecutor streamingExecutor(
      @Value("${digest.streaming.threads:8}") int threads,
      @Value("${digest.streaming.queue-size:32}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("summary-");
    return executor;
  }

  @Bean
  public WebMvcConfigurer asyncSupportConfigurer(
      @Qualifier("streamingExecutor") AsyncTaskExecutor streamingExecutor,
      @Value("${digest.streaming.timeout-seconds:300}") long timeoutSeconds) {
    return new WebMvcConfigurer() {
      @Override
      public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamingExecutor);
        configurer.setDefaultTimeout(timeoutSeconds * 1000);
      }
    };
  }
}
