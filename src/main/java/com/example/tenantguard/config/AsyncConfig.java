package com.example.tenantguard.config;

import com.example.tenantguard.properties.ApplicationProperties.AuditProperties.ExecutorProperties;
import com.example.tenantguard.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors and time source shared by the request pipeline.
 * <p>
 * Audit persistence runs on a small bounded pool. When its queue is full new records are
 * rejected rather than run on the request thread, and the pool drains its queue on shutdown.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class AsyncConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "auditExecutor")
  public ThreadPoolTaskExecutor auditExecutor(ApplicationProperties properties) {
    ExecutorProperties executor = properties.audit().executor();
    log.info("Configuring audit executor: core={}, max={}, queue={}",
             executor.coreSize(), executor.maxSize(), executor.queueCapacity());

    ThreadPoolTaskExecutor taskExecutor = new ThreadPoolTaskExecutor();
    taskExecutor.setCorePoolSize(executor.coreSize());
    taskExecutor.setMaxPoolSize(executor.maxSize());
    taskExecutor.setQueueCapacity(executor.queueCapacity());
    taskExecutor.setThreadNamePrefix("audit-");
    taskExecutor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    taskExecutor.setWaitForTasksToCompleteOnShutdown(true);
    taskExecutor.setAwaitTerminationSeconds(10);
    return taskExecutor;
  }
}
