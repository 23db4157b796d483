package com.streamraid.engine.playback;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpotifyPlaybackStateResponse(
    Boolean isPlaying, Long progressMs, Item item, Device device) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Item(String id, String type) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Device(String id, String name) {}
}
