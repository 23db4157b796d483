package com.streamraid.engine.model;

public enum RaidStatus {
  ACTIVE,
  COMPLETED,
  EXPIRED,
  CANCELLED
}
