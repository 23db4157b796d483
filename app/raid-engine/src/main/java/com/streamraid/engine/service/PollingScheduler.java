/*
 * どこで: Raid Engine ワーカー
 * 何を: 一定間隔で追跡中セッションを列挙し、評価を有界プールへ投入する
 * なぜ: 遅い外部 API 呼び出しがあっても周期処理と他セッションの評価を止めないため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.config.EngineExecutorConfig;
import com.streamraid.engine.session.SessionHandle;
import com.streamraid.engine.session.SessionRegistry;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "raid.engine.enabled", havingValue = "true", matchIfMissing = true)
public class PollingScheduler {

  private static final Logger logger = LoggerFactory.getLogger(PollingScheduler.class);

  private final SessionRegistry sessionRegistry;
  private final SessionEvaluator sessionEvaluator;
  private final TaskExecutor executor;
  private final RaidEngineMetrics metrics;

  public PollingScheduler(
      SessionRegistry sessionRegistry,
      SessionEvaluator sessionEvaluator,
      @Qualifier(EngineExecutorConfig.SESSION_EVALUATION_EXECUTOR) TaskExecutor executor,
      RaidEngineMetrics metrics) {
    this.sessionRegistry = sessionRegistry;
    this.sessionEvaluator = sessionEvaluator;
    this.executor = executor;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${raid.engine.tick-interval}")
  public void tick() {
    final List<SessionHandle> handles = sessionRegistry.listActive();
    int submitted = 0;
    for (SessionHandle handle : handles) {
      // 前回の評価が終わっていないセッションはこの周期では飛ばす
      if (!sessionRegistry.tryBeginEvaluation(handle)) {
        metrics.recordEvaluation("overlap_skipped");
        continue;
      }
      try {
        executor.execute(() -> evaluate(handle));
        submitted++;
      } catch (RejectedExecutionException ex) {
        sessionRegistry.endEvaluation(handle);
        metrics.recordEvaluation("rejected");
        logger.warn(
            "session evaluation rejected participantId={} raidId={}",
            handle.participantId(),
            handle.raidId());
      }
    }
    if (submitted > 0) {
      logger.debug("polling tick submitted={} sessions={}", submitted, handles.size());
    }
  }

  private void evaluate(SessionHandle handle) {
    try {
      sessionEvaluator.evaluate(handle);
    } finally {
      sessionRegistry.endEvaluation(handle);
    }
  }
}
