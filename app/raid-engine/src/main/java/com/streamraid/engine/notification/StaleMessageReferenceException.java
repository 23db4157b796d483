package com.streamraid.engine.notification;

public class StaleMessageReferenceException extends RuntimeException {

  public StaleMessageReferenceException(String messageRef) {
    super("message reference is no longer valid ref=" + messageRef);
  }
}
