package com.streamraid.engine.api;

public class PremiumRequiredException extends RuntimeException {

  public PremiumRequiredException(String message) {
    super(message);
  }
}
