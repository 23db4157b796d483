/*
 * どこで: Raid Engine サービス層
 * 何を: セッション数/評価結果/資格取得/請求/精算/通知のメトリクスを記録する
 * なぜ: ポーリングの健全性と報酬処理の滞留を Prometheus から直接観測できるようにするため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.session.SessionRegistry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RaidEngineMetrics {

  private static final String METRIC_SESSIONS_ACTIVE = "raid.sessions.active";
  private static final String METRIC_EVALUATION_TOTAL = "raid.evaluation.total";
  private static final String METRIC_VERIFIER_ERROR_TOTAL = "raid.verifier.error.total";
  private static final String METRIC_QUALIFIED_TOTAL = "raid.qualified.total";
  private static final String METRIC_CLAIM_TOTAL = "raid.claim.total";
  private static final String METRIC_SETTLEMENT_TOTAL = "raid.settlement.total";
  private static final String METRIC_NOTIFICATION_TOTAL = "raid.notification.total";
  private static final String METRIC_RAID_TRANSITION_TOTAL = "raid.lifecycle.transition.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public RaidEngineMetrics(MeterRegistry meterRegistry, SessionRegistry sessionRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SESSIONS_ACTIVE, sessionRegistry, SessionRegistry::size)
        .description("Number of live tracking sessions")
        .register(meterRegistry);
  }

  public void recordEvaluation(String result) {
    increment(METRIC_EVALUATION_TOTAL, "Session evaluation outcomes", Tags.of("result", result));
  }

  public void recordVerifierError(String platform, String reason) {
    increment(
        METRIC_VERIFIER_ERROR_TOTAL,
        "Playback verification failures",
        Tags.of("platform", platform, "reason", reason));
  }

  public void recordQualified(String platform) {
    increment(METRIC_QUALIFIED_TOTAL, "Participants that qualified", Tags.of("platform", platform));
  }

  public void recordClaim(String result) {
    increment(METRIC_CLAIM_TOTAL, "Reward claim outcomes", Tags.of("result", result));
  }

  public void recordSettlement(String result) {
    increment(METRIC_SETTLEMENT_TOTAL, "Settlement attempt outcomes", Tags.of("result", result));
  }

  public void recordNotification(String result) {
    increment(METRIC_NOTIFICATION_TOTAL, "Notification outcomes", Tags.of("result", result));
  }

  public void recordRaidTransition(String status) {
    increment(
        METRIC_RAID_TRANSITION_TOTAL, "Raid status transitions", Tags.of("status", status));
  }

  private void increment(String name, String description, Tags tags) {
    counters
        .computeIfAbsent(
            name + tags,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
