package com.streamraid.engine.model;

import java.time.Instant;

public record PlatformAuthorizationRecord(
    String participantId,
    Platform platform,
    String platformUserId,
    String accessToken,
    boolean premium,
    Instant expiresAt,
    Instant updatedAt) {}
