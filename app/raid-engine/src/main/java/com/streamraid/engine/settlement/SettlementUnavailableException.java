package com.streamraid.engine.settlement;

public class SettlementUnavailableException extends RuntimeException {

  public SettlementUnavailableException(String message) {
    super(message);
  }

  public SettlementUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
