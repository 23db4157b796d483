/*
 * どこで: Raid Engine 設定
 * 何を: セッション評価用の有界スレッドプールを提供する
 * なぜ: 外部 API の待ち時間をスケジューラスレッドから切り離し、並列度と滞留量を制限するため
 */
package com.streamraid.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EngineExecutorConfig {

  public static final String SESSION_EVALUATION_EXECUTOR = "sessionEvaluationExecutor";

  @Bean(name = SESSION_EVALUATION_EXECUTOR)
  public ThreadPoolTaskExecutor sessionEvaluationExecutor(RaidEngineProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerPoolSize());
    executor.setMaxPoolSize(properties.workerPoolSize());
    executor.setQueueCapacity(properties.workerQueueCapacity());
    executor.setThreadNamePrefix("raid-eval-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
