package com.streamraid.engine.model;

import java.time.Instant;
import java.util.UUID;

public record ParticipantProgress(
    String participantId,
    UUID raidId,
    int totalListenDuration,
    int requiredListenSeconds,
    boolean listening,
    boolean trackingActive,
    boolean qualified,
    Instant qualifiedAt,
    boolean claimedReward,
    SettlementStatus settlementStatus) {}
