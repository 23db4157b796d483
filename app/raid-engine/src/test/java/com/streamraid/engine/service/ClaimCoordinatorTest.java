package com.streamraid.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.streamraid.engine.api.AlreadyClaimedException;
import com.streamraid.engine.api.NotQualifiedException;
import com.streamraid.engine.api.RaidNotFoundException;
import com.streamraid.engine.config.SettlementProperties;
import com.streamraid.engine.model.ClaimResult;
import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.model.RaidStatus;
import com.streamraid.engine.model.SettlementStatus;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.repository.RaidRepository;
import com.streamraid.engine.session.SessionRegistry;
import com.streamraid.engine.settlement.SettlementProgram;
import com.streamraid.engine.settlement.SettlementUnavailableException;
import com.streamraid.engine.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClaimCoordinatorTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
  private static final UUID RAID = UUID.fromString("00000000-0000-0000-0000-0000000000cc");
  private static final BigDecimal REWARD = new BigDecimal("2.5");

  private final MutableClock clock = new MutableClock(T0);
  private final RaidRepository raidRepository = mock(RaidRepository.class);
  private final ParticipantRepository participantRepository = mock(ParticipantRepository.class);
  private final SettlementProgram settlementProgram = mock(SettlementProgram.class);
  private final SettlementProperties properties =
      new SettlementProperties(
          "local",
          null,
          null,
          null,
          Duration.ofMinutes(2),
          true,
          null,
          10,
          Duration.ofSeconds(30),
          Duration.ofMinutes(30));
  private ClaimCoordinator coordinator;

  @BeforeEach
  void setUp() {
    coordinator =
        new ClaimCoordinator(
            raidRepository,
            participantRepository,
            settlementProgram,
            properties,
            new RaidEngineMetrics(new SimpleMeterRegistry(), new SessionRegistry()),
            clock,
            () -> "host/lease-1");
    when(raidRepository.findById(RAID)).thenReturn(Optional.of(raid()));
  }

  @Test
  void qualifiedClaimSettlesAndRecordsReference() {
    when(participantRepository.claimReward(
            "p-1", RAID, T0, T0.plus(Duration.ofMinutes(2)), "host/lease-1"))
        .thenReturn(Optional.of(participant(true, true)));
    when(settlementProgram.settle("p-1", RAID, REWARD)).thenReturn("tx-1");

    final ClaimResult result = coordinator.claim("p-1", RAID);

    assertThat(result.settlementStatus()).isEqualTo(SettlementStatus.SETTLED);
    assertThat(result.settlementReference()).isEqualTo("tx-1");
    verify(participantRepository).markSettled("p-1", RAID, "tx-1", "host/lease-1");
  }

  @Test
  void settlementFailureKeepsClaimAndSchedulesRetry() {
    when(participantRepository.claimReward(eq("p-1"), eq(RAID), any(), any(), anyString()))
        .thenReturn(Optional.of(participant(true, true)));
    when(settlementProgram.settle("p-1", RAID, REWARD))
        .thenThrow(new SettlementUnavailableException("down"));

    final ClaimResult result = coordinator.claim("p-1", RAID);

    assertThat(result.settlementStatus()).isEqualTo(SettlementStatus.PENDING);
    assertThat(result.settlementReference()).isNull();
    verify(participantRepository)
        .markSettlementRetry("p-1", RAID, 1, T0.plusSeconds(30), "host/lease-1");
    verify(participantRepository, never())
        .markSettled(anyString(), any(), anyString(), anyString());
  }

  @Test
  void secondClaimFailsWithAlreadyClaimed() {
    when(participantRepository.claimReward(eq("p-1"), eq(RAID), any(), any(), anyString()))
        .thenReturn(Optional.empty());
    when(participantRepository.find("p-1", RAID)).thenReturn(Optional.of(participant(true, true)));

    assertThatThrownBy(() -> coordinator.claim("p-1", RAID))
        .isInstanceOf(AlreadyClaimedException.class);
    verify(settlementProgram, never()).settle(anyString(), any(), any());
  }

  @Test
  void unqualifiedClaimFails() {
    when(participantRepository.claimReward(eq("p-1"), eq(RAID), any(), any(), anyString()))
        .thenReturn(Optional.empty());
    when(participantRepository.find("p-1", RAID))
        .thenReturn(Optional.of(participant(false, false)));

    assertThatThrownBy(() -> coordinator.claim("p-1", RAID))
        .isInstanceOf(NotQualifiedException.class);
  }

  @Test
  void unknownRaidFails() {
    final UUID unknown = UUID.randomUUID();
    when(raidRepository.findById(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> coordinator.claim("p-1", unknown))
        .isInstanceOf(RaidNotFoundException.class);
  }

  @Test
  void concurrentClaimsSettleExactlyOnce() throws Exception {
    // 条件付き UPDATE と同じく最初の 1 件だけが行を得る
    final AtomicBoolean claimed = new AtomicBoolean(false);
    when(participantRepository.claimReward(eq("p-1"), eq(RAID), any(), any(), anyString()))
        .thenAnswer(
            invocation ->
                claimed.compareAndSet(false, true)
                    ? Optional.of(participant(true, true))
                    : Optional.empty());
    when(participantRepository.find("p-1", RAID)).thenReturn(Optional.of(participant(true, true)));
    when(settlementProgram.settle("p-1", RAID, REWARD)).thenReturn("tx-1");

    final int attempts = 16;
    final ExecutorService executor = Executors.newFixedThreadPool(attempts);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<String>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < attempts; i++) {
        final Callable<String> claim =
            () -> {
              start.await(5, TimeUnit.SECONDS);
              try {
                return coordinator.claim("p-1", RAID).settlementStatus().name();
              } catch (AlreadyClaimedException ex) {
                return "ALREADY_CLAIMED";
              }
            };
        futures.add(executor.submit(claim));
      }
      start.countDown();
      final List<String> outcomes = new ArrayList<>();
      for (Future<String> future : futures) {
        outcomes.add(future.get(10, TimeUnit.SECONDS));
      }

      assertThat(outcomes).filteredOn("SETTLED"::equals).hasSize(1);
      assertThat(outcomes).filteredOn("ALREADY_CLAIMED"::equals).hasSize(attempts - 1);
      verify(settlementProgram, times(1)).settle("p-1", RAID, REWARD);
    } finally {
      executor.shutdownNow();
    }
  }

  private RaidRecord raid() {
    return new RaidRecord(
        RAID,
        "track-1",
        Platform.SPOTIFY,
        30,
        1,
        null,
        REWARD,
        false,
        RaidStatus.COMPLETED,
        T0.plusSeconds(3600),
        T0.minusSeconds(60),
        T0);
  }

  private ParticipantRecord participant(boolean qualified, boolean claimed) {
    return new ParticipantRecord(
        "p-1",
        RAID,
        false,
        qualified ? 30 : 12,
        T0,
        false,
        qualified,
        qualified ? T0 : null,
        claimed,
        claimed ? T0 : null,
        null,
        claimed ? SettlementStatus.PROCESSING : SettlementStatus.NONE,
        0,
        null,
        null,
        null,
        T0.minusSeconds(40));
  }
}
