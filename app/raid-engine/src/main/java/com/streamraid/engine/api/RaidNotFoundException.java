package com.streamraid.engine.api;

public class RaidNotFoundException extends RuntimeException {

  public RaidNotFoundException(String message) {
    super(message);
  }
}
