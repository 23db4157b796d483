package com.streamraid.engine.session;

import java.util.Objects;
import java.util.UUID;

/** At most one live session exists per key. */
public record SessionKey(String participantId, UUID raidId) {

  public SessionKey {
    Objects.requireNonNull(participantId, "participantId");
    Objects.requireNonNull(raidId, "raidId");
  }
}
