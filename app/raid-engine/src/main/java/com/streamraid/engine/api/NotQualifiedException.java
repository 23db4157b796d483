package com.streamraid.engine.api;

public class NotQualifiedException extends RuntimeException {

  public NotQualifiedException(String message) {
    super(message);
  }
}
