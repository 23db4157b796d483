package com.streamraid.engine.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JoinRaidResponse(
    String participantId,
    String raidId,
    String trackId,
    String platform,
    int requiredSeconds,
    boolean premiumTier,
    String startedAt) {}
