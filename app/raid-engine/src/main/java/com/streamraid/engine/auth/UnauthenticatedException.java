package com.streamraid.engine.auth;

import com.streamraid.engine.model.Platform;

public class UnauthenticatedException extends RuntimeException {

  private final Platform platform;

  public UnauthenticatedException(Platform platform, String message) {
    super(message);
    this.platform = platform;
  }

  public Platform platform() {
    return platform;
  }
}
