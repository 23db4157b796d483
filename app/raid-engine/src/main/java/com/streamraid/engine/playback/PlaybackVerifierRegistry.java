package com.streamraid.engine.playback;

import com.streamraid.engine.model.Platform;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Looks up the verifier for a raid's platform. */
@Component
public class PlaybackVerifierRegistry {

  private final Map<Platform, PlaybackVerifier> verifiers = new EnumMap<>(Platform.class);

  public PlaybackVerifierRegistry(List<PlaybackVerifier> verifiers) {
    for (PlaybackVerifier verifier : verifiers) {
      if (this.verifiers.putIfAbsent(verifier.platform(), verifier) != null) {
        throw new IllegalStateException("duplicate playback verifier for " + verifier.platform());
      }
    }
  }

  public PlaybackVerifier verifierFor(Platform platform) {
    final PlaybackVerifier verifier = verifiers.get(platform);
    if (verifier == null) {
      throw new IllegalStateException("no playback verifier for " + platform);
    }
    return verifier;
  }
}
