package com.streamraid.engine.notification;

public enum NotificationKind {
  JOINED,
  PROGRESS,
  QUALIFIED,
  REAUTHORIZE,
  RAID_COMPLETED,
  RAID_EXPIRED
}
