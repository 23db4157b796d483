package com.streamraid.engine.api;

public class InvalidRaidRequestException extends RuntimeException {

  public InvalidRaidRequestException(String message) {
    super(message);
  }
}
