package com.streamraid.engine.notification;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Content of a participant-facing status message.
 *
 * @param listenedSeconds persisted progress at the time of the message
 * @param rewardAmount reward of the raid, only set for completion messages
 */
public record NotificationMessage(
    NotificationKind kind,
    String participantId,
    UUID raidId,
    int listenedSeconds,
    int requiredSeconds,
    boolean listening,
    BigDecimal rewardAmount) {

  public static NotificationMessage joined(String participantId, UUID raidId, int required) {
    return new NotificationMessage(
        NotificationKind.JOINED, participantId, raidId, 0, required, false, null);
  }

  public static NotificationMessage progress(
      String participantId, UUID raidId, int listened, int required, boolean listening) {
    return new NotificationMessage(
        NotificationKind.PROGRESS, participantId, raidId, listened, required, listening, null);
  }

  public static NotificationMessage qualified(
      String participantId, UUID raidId, int listened, int required) {
    return new NotificationMessage(
        NotificationKind.QUALIFIED, participantId, raidId, listened, required, false, null);
  }

  public static NotificationMessage reauthorize(String participantId, UUID raidId) {
    return new NotificationMessage(
        NotificationKind.REAUTHORIZE, participantId, raidId, 0, 0, false, null);
  }

  public static NotificationMessage raidEnded(
      NotificationKind kind, String participantId, UUID raidId, BigDecimal rewardAmount) {
    return new NotificationMessage(kind, participantId, raidId, 0, 0, false, rewardAmount);
  }

  /** 0 から 100 に丸めた進捗率。 */
  public int percent() {
    if (requiredSeconds <= 0) {
      return kind == NotificationKind.QUALIFIED ? 100 : 0;
    }
    return (int) Math.min(100L, (long) listenedSeconds * 100 / requiredSeconds);
  }
}
