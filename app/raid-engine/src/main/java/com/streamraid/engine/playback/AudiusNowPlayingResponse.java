package com.streamraid.engine.playback;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AudiusNowPlayingResponse(Track data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Track(String id, String title) {}
}
