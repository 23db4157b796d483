package com.streamraid.engine.session;

import com.streamraid.engine.model.Platform;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable reference to one generation of a tracking session.
 *
 * <p>Handles stay valid to hold after the session is removed or replaced. Mutations through a
 * stale handle are ignored by {@link SessionRegistry#mutate}.
 */
public record SessionHandle(
    SessionKey key,
    long generation,
    String trackId,
    Platform platform,
    int requiredSeconds,
    boolean premiumTier,
    Instant expiresAt,
    Instant startedAt) {

  public String participantId() {
    return key.participantId();
  }

  public UUID raidId() {
    return key.raidId();
  }

  /** raid の期限を過ぎたセッションはこれ以上評価しない。 */
  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }
}
