package com.streamraid.engine.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantProgressResponse(
    String participantId,
    String raidId,
    int listenedSeconds,
    int requiredSeconds,
    int percent,
    boolean listening,
    boolean trackingActive,
    boolean qualified,
    String qualifiedAt,
    boolean claimedReward,
    String settlementStatus) {}
