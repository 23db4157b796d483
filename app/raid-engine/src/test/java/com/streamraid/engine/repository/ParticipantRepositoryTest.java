/*
 * どこで: Raid Engine リポジトリテスト
 * 何を: 参加/進捗/資格/請求/精算リースの SQL を Postgres で検証する
 * なぜ: ON CONFLICT と UPDATE ... RETURNING + SKIP LOCKED の挙動を実 DB で確認するため
 */
package com.streamraid.engine.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamraid.engine.AbstractPostgresContainerTest;
import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.PendingSettlement;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.model.RecoverableSession;
import com.streamraid.engine.model.SettlementStatus;
import com.streamraid.engine.support.RaidFixtures;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ParticipantRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private RaidRepository raidRepository;
  @Autowired private ParticipantRepository participantRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private final Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
  private RaidRecord raid;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM raid_participants", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM raids", new MapSqlParameterSource());
    raid = RaidFixtures.activeRaid(now, 30, 3);
    raidRepository.insert(raid);
  }

  @Test
  void rejoinResetsProgressOfUnqualifiedParticipant() {
    final ParticipantRecord joined =
        participantRepository.upsertJoin("p-1", raid.raidId(), now).orElseThrow();
    assertThat(joined.trackingActive()).isTrue();
    assertThat(joined.settlementStatus()).isEqualTo(SettlementStatus.NONE);

    participantRepository.updateProgress("p-1", raid.raidId(), true, 17, now.plusSeconds(17));
    final ParticipantRecord rejoined =
        participantRepository.upsertJoin("p-1", raid.raidId(), now.plusSeconds(20)).orElseThrow();

    assertThat(rejoined.totalListenDuration()).isZero();
    assertThat(rejoined.listening()).isFalse();
    assertThat(rejoined.joinedAt()).isEqualTo(now);
    assertThat(raidRepository.countParticipants(raid.raidId())).isEqualTo(1);
  }

  @Test
  void qualifiedParticipantIsFrozen() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);

    assertThat(participantRepository.markQualified("p-1", raid.raidId(), 30, now)).isEqualTo(1);
    assertThat(participantRepository.markQualified("p-1", raid.raidId(), 31, now)).isZero();
    assertThat(participantRepository.updateProgress("p-1", raid.raidId(), false, 0, now))
        .isZero();
    assertThat(participantRepository.upsertJoin("p-1", raid.raidId(), now)).isEmpty();

    final ParticipantRecord record = participantRepository.find("p-1", raid.raidId()).orElseThrow();
    assertThat(record.qualified()).isTrue();
    assertThat(record.totalListenDuration()).isEqualTo(30);
    assertThat(record.trackingActive()).isFalse();
    assertThat(participantRepository.findQualified(raid.raidId())).hasSize(1);
  }

  @Test
  void claimRequiresQualification() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);

    assertThat(participantRepository.claimReward("p-1", raid.raidId(), now, now, "lease-1"))
        .isEmpty();
  }

  @Test
  void concurrentClaimsSucceedExactlyOnce() throws Exception {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);
    participantRepository.markQualified("p-1", raid.raidId(), 30, now);

    final int threads = 8;
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<Optional<ParticipantRecord>>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        final String lease = "lease-" + i;
        final Callable<Optional<ParticipantRecord>> task =
            () -> {
              start.await();
              return participantRepository.claimReward(
                  "p-1", raid.raidId(), now, now.plusSeconds(120), lease);
            };
        results.add(executor.submit(task));
      }
      start.countDown();
      int wins = 0;
      for (Future<Optional<ParticipantRecord>> result : results) {
        if (result.get().isPresent()) {
          wins++;
        }
      }
      assertThat(wins).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
    final ParticipantRecord record = participantRepository.find("p-1", raid.raidId()).orElseThrow();
    assertThat(record.claimedReward()).isTrue();
    assertThat(record.settlementStatus()).isEqualTo(SettlementStatus.PROCESSING);
  }

  @Test
  void settlementOutcomeRequiresHoldingTheLease() {
    qualifyAndClaim("p-1", "lease-1", now.plusSeconds(120));

    assertThat(participantRepository.markSettled("p-1", raid.raidId(), "tx-1", "lease-other"))
        .isZero();
    assertThat(participantRepository.markSettled("p-1", raid.raidId(), "tx-1", "lease-1"))
        .isEqualTo(1);

    final ParticipantRecord record = participantRepository.find("p-1", raid.raidId()).orElseThrow();
    assertThat(record.settlementStatus()).isEqualTo(SettlementStatus.SETTLED);
    assertThat(record.claimTxReference()).isEqualTo("tx-1");
  }

  @Test
  void pendingAndLeaseExpiredClaimsAreLeasedForRetry() {
    qualifyAndClaim("p-1", "lease-1", now.plusSeconds(120));
    participantRepository.markSettlementRetry("p-1", raid.raidId(), 1, now, "lease-1");
    qualifyAndClaim("p-2", "lease-2", now.minusSeconds(1));
    qualifyAndClaim("p-3", "lease-3", now.plusSeconds(120));

    final List<PendingSettlement> leased =
        participantRepository.claimPendingSettlements(10, now, now.plusSeconds(120), "worker");

    assertThat(leased)
        .extracting(PendingSettlement::participantId)
        .containsExactlyInAnyOrder("p-1", "p-2");
    assertThat(leased).allSatisfy(p -> assertThat(p.rewardAmount()).isEqualByComparingTo("5"));
    assertThat(
            participantRepository.claimPendingSettlements(
                10, now, now.plus(Duration.ofMinutes(2)), "worker-2"))
        .isEmpty();
  }

  @Test
  void retryIsDeferredUntilNextRetryAt() {
    qualifyAndClaim("p-1", "lease-1", now.plusSeconds(120));
    participantRepository.markSettlementRetry(
        "p-1", raid.raidId(), 1, now.plusSeconds(30), "lease-1");

    assertThat(participantRepository.claimPendingSettlements(10, now, now, "worker")).isEmpty();
    assertThat(
            participantRepository.claimPendingSettlements(
                10, now.plusSeconds(30), now.plusSeconds(150), "worker"))
        .hasSize(1);
  }

  @Test
  void recoverableSessionsAreTrackedUnqualifiedParticipantsOfLiveRaids() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);
    participantRepository.updateProgress("p-1", raid.raidId(), true, 12, now);
    participantRepository.upsertJoin("p-2", raid.raidId(), now);
    participantRepository.stopTracking("p-2", raid.raidId(), now);

    final List<RecoverableSession> recoverable = participantRepository.findRecoverable(now);

    assertThat(recoverable).hasSize(1);
    assertThat(recoverable.get(0).participantId()).isEqualTo("p-1");
    assertThat(recoverable.get(0).listening()).isTrue();
    assertThat(recoverable.get(0).totalListenDuration()).isEqualTo(12);
    assertThat(recoverable.get(0).expiresAt()).isEqualTo(raid.expiresAt());
  }

  @Test
  void participantOfExpiredRaidCannotQualifyOrProgress() {
    final RaidRecord expiring = RaidFixtures.expiringRaid(now, now.plusSeconds(20));
    raidRepository.insert(expiring);
    participantRepository.upsertJoin("p-1", expiring.raidId(), now);

    assertThat(
            participantRepository.updateProgress(
                "p-1", expiring.raidId(), true, 30, now.plusSeconds(30)))
        .isZero();
    assertThat(
            participantRepository.markQualified("p-1", expiring.raidId(), 30, now.plusSeconds(30)))
        .isZero();
    assertThat(participantRepository.find("p-1", expiring.raidId()).orElseThrow().qualified())
        .isFalse();

    // 期限ちょうどはまだ有効
    assertThat(
            participantRepository.markQualified("p-1", expiring.raidId(), 30, now.plusSeconds(20)))
        .isEqualTo(1);
  }

  @Test
  void participantOfCompletedRaidCannotQualify() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);
    jdbcTemplate.update(
        "UPDATE raids SET status = 'COMPLETED' WHERE raid_id = :raidId",
        new MapSqlParameterSource("raidId", raid.raidId()));

    assertThat(participantRepository.markQualified("p-1", raid.raidId(), 30, now)).isZero();
    assertThat(participantRepository.updateProgress("p-1", raid.raidId(), true, 10, now))
        .isZero();
    assertThat(participantRepository.find("p-1", raid.raidId()).orElseThrow().qualified())
        .isFalse();
  }

  @Test
  void staleJoinersWithoutProgressAreDeleted() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now.minusSeconds(300));
    participantRepository.stopTracking("p-1", raid.raidId(), now);
    participantRepository.upsertJoin("p-2", raid.raidId(), now.minusSeconds(300));

    assertThat(participantRepository.deleteStaleJoiners(now.minusSeconds(60))).isEqualTo(1);
    assertThat(participantRepository.find("p-1", raid.raidId())).isEmpty();
    assertThat(participantRepository.find("p-2", raid.raidId())).isPresent();
  }

  @Test
  void stopTrackingForRaidOnlyTouchesActiveRows() {
    participantRepository.upsertJoin("p-1", raid.raidId(), now);
    participantRepository.upsertJoin("p-2", raid.raidId(), now);
    participantRepository.stopTracking("p-2", raid.raidId(), now);

    assertThat(participantRepository.stopTrackingForRaid(raid.raidId(), now)).isEqualTo(1);
  }

  private void qualifyAndClaim(String participantId, String lease, Instant leaseUntil) {
    participantRepository.upsertJoin(participantId, raid.raidId(), now);
    participantRepository.markQualified(participantId, raid.raidId(), 30, now);
    participantRepository.claimReward(participantId, raid.raidId(), now, leaseUntil, lease);
  }
}
