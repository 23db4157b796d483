package com.streamraid.engine.playback;

import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.PlaybackStatus;

/** Asks a streaming platform what a participant is playing right now. */
public interface PlaybackVerifier {

  Platform platform();

  /**
   * Checks whether {@code trackId} is actively playing for the participant.
   *
   * @throws PlaybackVerificationException when the platform could not answer
   */
  PlaybackStatus checkPlayback(String participantId, String trackId);
}
