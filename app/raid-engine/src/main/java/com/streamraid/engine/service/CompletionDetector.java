/*
 * どこで: Raid Engine サービス層
 * 何を: raid の完了/期限切れを確定し、関連セッションの停止と通知を行う
 * なぜ: 同時に資格取得が起きても完了処理と通知を一度だけ実行するため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.model.RaidStatus;
import com.streamraid.engine.notification.NotificationDispatcher;
import com.streamraid.engine.notification.NotificationKind;
import com.streamraid.engine.notification.NotificationMessage;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.repository.RaidRepository;
import com.streamraid.engine.session.SessionRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CompletionDetector {

  private static final Logger logger = LoggerFactory.getLogger(CompletionDetector.class);

  private final RaidRepository raidRepository;
  private final ParticipantRepository participantRepository;
  private final SessionRegistry sessionRegistry;
  private final NotificationDispatcher notificationDispatcher;
  private final RaidEngineMetrics metrics;
  private final Clock clock;

  /**
   * 資格者数が目標に達していれば raid を COMPLETED にする。
   *
   * @return この呼び出しで COMPLETED に遷移させた場合だけ true
   */
  public boolean tryComplete(UUID raidId) {
    final Instant now = Instant.now(clock);
    if (!raidRepository.completeIfGoalReached(raidId, now)) {
      return false;
    }
    logger.info("raid completed raidId={}", raidId);
    metrics.recordRaidTransition(RaidStatus.COMPLETED.name().toLowerCase(Locale.ROOT));
    retireSessions(raidId, now);
    final RaidRecord raid = raidRepository.findById(raidId).orElse(null);
    for (ParticipantRecord participant : participantRepository.findQualified(raidId)) {
      notificationDispatcher.dispatch(
          NotificationMessage.raidEnded(
              NotificationKind.RAID_COMPLETED,
              participant.participantId(),
              raidId,
              raid == null ? null : raid.rewardAmount()));
    }
    return true;
  }

  /** 資格取得時の判定が失敗した場合に備え、ACTIVE な raid を順に再判定する。 */
  public int sweepActiveRaids() {
    int completed = 0;
    for (UUID raidId : raidRepository.findActiveRaidIds(Instant.now(clock))) {
      try {
        if (tryComplete(raidId)) {
          completed++;
        }
      } catch (RuntimeException ex) {
        logger.warn("raid completion check failed raidId={}", raidId, ex);
      }
    }
    return completed;
  }

  public List<UUID> expireOverdueRaids() {
    final Instant now = Instant.now(clock);
    final List<UUID> expired = raidRepository.expireOverdue(now);
    for (UUID raidId : expired) {
      logger.info("raid expired raidId={}", raidId);
      metrics.recordRaidTransition(RaidStatus.EXPIRED.name().toLowerCase(Locale.ROOT));
      retireSessions(raidId, now);
    }
    return expired;
  }

  private void retireSessions(UUID raidId, Instant now) {
    // セッションを先に外し、実行中の評価が終わってから追跡フラグを落とす
    final int removed = sessionRegistry.removeRaid(raidId);
    final int stopped = participantRepository.stopTrackingForRaid(raidId, now);
    logger.info("raid sessions retired raidId={} removed={} stopped={}", raidId, removed, stopped);
  }
}
