package com.streamraid.engine.model;

import java.util.Locale;

/** Streaming platform a raid is played on. */
public enum Platform {
  SPOTIFY(true),
  AUDIUS(false);

  private final boolean requiresAccessToken;

  Platform(boolean requiresAccessToken) {
    this.requiresAccessToken = requiresAccessToken;
  }

  public boolean requiresAccessToken() {
    return requiresAccessToken;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Platform fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("platform is required");
    }
    return Platform.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
