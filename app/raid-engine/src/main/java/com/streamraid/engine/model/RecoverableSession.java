package com.streamraid.engine.model;

import java.time.Instant;
import java.util.UUID;

/** Persisted tracking state joined with its raid, used to rebuild sessions after a restart. */
public record RecoverableSession(
    String participantId,
    UUID raidId,
    String trackId,
    Platform platform,
    int requiredListenSeconds,
    Instant expiresAt,
    boolean listening,
    int totalListenDuration) {}
