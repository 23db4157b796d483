package com.streamraid.engine.model;

import java.time.Instant;

/**
 * One observation of what a participant is playing.
 *
 * @param playing true only when the raid's track is actively playing
 * @param positionMs playback position reported by the platform, if any
 * @param observedAt engine time of the observation
 * @param deviceRef platform device identifier, if any
 */
public record PlaybackStatus(boolean playing, Long positionMs, Instant observedAt, String deviceRef) {

  public static PlaybackStatus notPlaying(Instant observedAt) {
    return new PlaybackStatus(false, null, observedAt, null);
  }
}
