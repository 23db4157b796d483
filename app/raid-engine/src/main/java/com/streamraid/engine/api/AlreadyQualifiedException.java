package com.streamraid.engine.api;

public class AlreadyQualifiedException extends RuntimeException {

  public AlreadyQualifiedException(String message) {
    super(message);
  }
}
