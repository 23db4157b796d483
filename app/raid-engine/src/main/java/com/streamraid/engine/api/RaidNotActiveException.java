package com.streamraid.engine.api;

public class RaidNotActiveException extends RuntimeException {

  public RaidNotActiveException(String message) {
    super(message);
  }
}
