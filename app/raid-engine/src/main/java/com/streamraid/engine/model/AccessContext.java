package com.streamraid.engine.model;

/** Credentials that are valid right now for one participant on one platform. */
public record AccessContext(
    String participantId,
    Platform platform,
    String platformUserId,
    String accessToken,
    boolean premium) {

  @Override
  public String toString() {
    return "AccessContext[participantId="
        + participantId
        + ", platform="
        + platform
        + ", platformUserId="
        + platformUserId
        + ", premium="
        + premium
        + "]";
  }
}
