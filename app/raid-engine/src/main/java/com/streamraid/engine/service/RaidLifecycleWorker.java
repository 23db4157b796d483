/*
 * どこで: Raid Engine ワーカー
 * 何を: 期限切れ raid の確定と完了判定の再実行を定期的に行う
 * なぜ: 資格取得時の完了判定が失敗しても最終的に状態を収束させるため
 */
package com.streamraid.engine.service;

import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "raid.engine.enabled", havingValue = "true", matchIfMissing = true)
public class RaidLifecycleWorker {

  private static final Logger logger = LoggerFactory.getLogger(RaidLifecycleWorker.class);

  private final CompletionDetector completionDetector;

  @Scheduled(fixedDelayString = "${raid.engine.lifecycle-interval}")
  public void run() {
    try {
      final List<UUID> expired = completionDetector.expireOverdueRaids();
      final int completed = completionDetector.sweepActiveRaids();
      if (!expired.isEmpty() || completed > 0) {
        logger.info("raid lifecycle expired={} completed={}", expired.size(), completed);
      }
    } catch (RuntimeException ex) {
      logger.warn("raid lifecycle worker loop failed", ex);
    }
  }
}
