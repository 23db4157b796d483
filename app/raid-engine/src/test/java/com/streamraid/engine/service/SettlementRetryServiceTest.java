package com.streamraid.engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.streamraid.engine.config.SettlementProperties;
import com.streamraid.engine.model.PendingSettlement;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.session.SessionRegistry;
import com.streamraid.engine.settlement.SettlementProgram;
import com.streamraid.engine.settlement.SettlementUnavailableException;
import com.streamraid.engine.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SettlementRetryServiceTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
  private static final UUID RAID = UUID.fromString("00000000-0000-0000-0000-0000000000ee");

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
          5,
          Duration.ofSeconds(30),
          Duration.ofMinutes(2));
  private final SettlementRetryService service =
      new SettlementRetryService(
          participantRepository,
          settlementProgram,
          properties,
          new RaidEngineMetrics(new SimpleMeterRegistry(), new SessionRegistry()),
          new MutableClock(T0),
          () -> "host/lease-2");

  @Test
  void settlesLeasedClaims() {
    when(participantRepository.claimPendingSettlements(
            5, T0, T0.plus(Duration.ofMinutes(2)), "host/lease-2"))
        .thenReturn(List.of(new PendingSettlement("p-1", RAID, BigDecimal.ONE, 1)));
    when(settlementProgram.settle("p-1", RAID, BigDecimal.ONE)).thenReturn("tx-9");

    assertThat(service.processPendingBatch()).isEqualTo(1);

    verify(participantRepository).markSettled("p-1", RAID, "tx-9", "host/lease-2");
  }

  @Test
  void failureBacksOffExponentiallyUpToMax() {
    when(participantRepository.claimPendingSettlements(
            5, T0, T0.plus(Duration.ofMinutes(2)), "host/lease-2"))
        .thenReturn(
            List.of(
                new PendingSettlement("p-1", RAID, BigDecimal.ONE, 1),
                new PendingSettlement("p-2", RAID, BigDecimal.ONE, 7)));
    when(settlementProgram.settle("p-1", RAID, BigDecimal.ONE))
        .thenThrow(new SettlementUnavailableException("down"));
    when(settlementProgram.settle("p-2", RAID, BigDecimal.ONE))
        .thenThrow(new SettlementUnavailableException("down"));
    when(participantRepository.markSettlementRetry(
            anyString(),
            any(),
            anyInt(),
            any(),
            anyString()))
        .thenReturn(1);

    assertThat(service.processPendingBatch()).isZero();

    verify(participantRepository)
        .markSettlementRetry("p-1", RAID, 2, T0.plusSeconds(60), "host/lease-2");
    verify(participantRepository)
        .markSettlementRetry("p-2", RAID, 8, T0.plus(Duration.ofMinutes(2)), "host/lease-2");
  }
}
