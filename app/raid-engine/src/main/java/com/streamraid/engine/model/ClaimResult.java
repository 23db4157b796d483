package com.streamraid.engine.model;

import java.math.BigDecimal;
import java.util.UUID;

public record ClaimResult(
    String participantId,
    UUID raidId,
    BigDecimal rewardAmount,
    SettlementStatus settlementStatus,
    String settlementReference) {}
