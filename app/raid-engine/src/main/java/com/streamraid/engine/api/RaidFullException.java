package com.streamraid.engine.api;

public class RaidFullException extends RuntimeException {

  public RaidFullException(String message) {
    super(message);
  }
}
