package com.streamraid.engine.model;

import java.math.BigDecimal;
import java.util.UUID;

public record PendingSettlement(
    String participantId, UUID raidId, BigDecimal rewardAmount, int settlementAttempts) {}
