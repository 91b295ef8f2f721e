package com.arganhr.adminauth.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AuthTaskConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Bounded pool; a full queue rejects instead of blocking the request thread. */
  @Bean(name = "authTaskExecutor")
  public ThreadPoolTaskExecutor authTaskExecutor(AuthTaskProperties props) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(props.corePoolSize());
    executor.setMaxPoolSize(props.maxPoolSize());
    executor.setQueueCapacity(props.queueCapacity());
    executor.setThreadNamePrefix("auth-task-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
