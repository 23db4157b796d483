package com.streamraid.engine.api;

public class ParticipantNotFoundException extends RuntimeException {

  public ParticipantNotFoundException(String message) {
    super(message);
  }
}
