package com.streamraid.engine.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimRewardResponse(
    String participantId,
    String raidId,
    BigDecimal rewardAmount,
    String settlementStatus,
    String settlementReference) {}
