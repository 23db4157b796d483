/*
 * どこで: Raid Engine モデル
 * 何を: raid_participants テーブルの 1 行を表現する
 * なぜ: 進捗/資格/請求/精算/通知の永続状態をまとめて扱うため
 */
package com.streamraid.engine.model;

import java.time.Instant;
import java.util.UUID;

public record ParticipantRecord(
    String participantId,
    UUID raidId,
    boolean listening,
    int totalListenDuration,
    Instant lastCheckedAt,
    boolean trackingActive,
    boolean qualified,
    Instant qualifiedAt,
    boolean claimedReward,
    Instant claimedAt,
    String claimTxReference,
    SettlementStatus settlementStatus,
    int settlementAttempts,
    Instant settlementNextRetryAt,
    String lastNotificationMessageRef,
    Instant lastNotifiedAt,
    Instant joinedAt) {}
