package com.scholary.songscraper.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the song task executor.
 *
 * <p>A single fixed-size pool shared by every job: the thread count is the global bound on
 * concurrently running song tasks. Tasks start in FIFO order. The queue holds at most
 * {@code maxQueuedSongs} waiting tasks; beyond that the executor rejects new songs, which are
 * then never run for their job.
 */
@Configuration
public class WorkerPoolConfig {

  @Bean(name = "songTaskExecutor")
  public Executor songTaskExecutor(ScraperProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentWorkers());
    executor.setMaxPoolSize(properties.maxConcurrentWorkers());
    executor.setQueueCapacity(properties.maxQueuedSongs());
    executor.setThreadNamePrefix("song-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
