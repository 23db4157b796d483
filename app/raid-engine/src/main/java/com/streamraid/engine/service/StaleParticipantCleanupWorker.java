/*
 * どこで: Raid Engine ワーカー
 * 何を: 参加後に一度も再生されず追跡も止まった参加者を定期削除する
 * なぜ: 定員枠を放置された参加登録に占有させないため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.config.CleanupProperties;
import com.streamraid.engine.repository.ParticipantRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "raid.cleanup.enabled", havingValue = "true")
public class StaleParticipantCleanupWorker {

  private static final Logger logger = LoggerFactory.getLogger(StaleParticipantCleanupWorker.class);

  private final ParticipantRepository participantRepository;
  private final CleanupProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${raid.cleanup.interval}")
  public void run() {
    try {
      final Instant threshold = Instant.now(clock).minus(properties.staleJoinerAge());
      final int deleted = participantRepository.deleteStaleJoiners(threshold);
      if (deleted > 0) {
        logger.info("stale participants removed count={}", deleted);
      }
    } catch (RuntimeException ex) {
      logger.warn("stale participant cleanup failed", ex);
    }
  }
}
