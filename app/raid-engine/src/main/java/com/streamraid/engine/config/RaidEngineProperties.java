/*
 * どこで: Raid Engine の設定バインド
 * 何を: ポーリング周期/ワーカープール/通知間引き/ライフサイクル周期を保持する
 * なぜ: 再生確認の間隔と並列度を環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.streamraid.engine.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "raid.engine")
@Validated
public record RaidEngineProperties(
    boolean enabled,
    @NotNull Duration tickInterval,
    @NotNull @Positive Integer workerPoolSize,
    @NotNull @Positive Integer workerQueueCapacity,
    @NotNull Duration progressNotifyInterval,
    @NotNull Duration lifecycleInterval,
    boolean recoverOnStartup) {

  @AssertTrue(message = "raid.engine.tick-interval must be positive")
  public boolean isTickIntervalPositive() {
    return isPositiveDuration(tickInterval);
  }

  @AssertTrue(message = "raid.engine.progress-notify-interval must be positive")
  public boolean isProgressNotifyIntervalPositive() {
    return isPositiveDuration(progressNotifyInterval);
  }

  @AssertTrue(message = "raid.engine.lifecycle-interval must be positive")
  public boolean isLifecycleIntervalPositive() {
    return isPositiveDuration(lifecycleInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
