package com.streamraid.engine.session;

public enum SessionTransition {
  STARTED_LISTENING,
  CONTINUED_LISTENING,
  RESET,
  STAYED_IDLE,
  QUALIFIED,
  /** raid が期限切れ/終了済みで、評価を打ち切った。 */
  RAID_ENDED
}
