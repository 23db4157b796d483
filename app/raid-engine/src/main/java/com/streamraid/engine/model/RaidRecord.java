/*
 * どこで: Raid Engine モデル
 * 何を: raids テーブルの 1 行を表現する
 * なぜ: 参加判定/完了判定/報酬額の参照を型で扱うため
 */
package com.streamraid.engine.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RaidRecord(
    UUID raidId,
    String trackId,
    Platform platform,
    int requiredListenSeconds,
    int participantGoal,
    Integer maxParticipants,
    BigDecimal rewardAmount,
    boolean premiumOnly,
    RaidStatus status,
    Instant expiresAt,
    Instant createdAt,
    Instant completedAt) {

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean acceptsParticipantsAt(Instant now) {
    return status == RaidStatus.ACTIVE && !isExpiredAt(now);
  }
}
