package com.streamraid.engine.api;

public class AlreadyClaimedException extends RuntimeException {

  public AlreadyClaimedException(String message) {
    super(message);
  }
}
