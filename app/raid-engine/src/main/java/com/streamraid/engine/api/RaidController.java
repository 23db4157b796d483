/*
 * どこで: Raid Engine API
 * 何を: 参加/離脱/報酬請求/進捗照会のエンドポイントを公開する
 * なぜ: チャットボットやフロントエンドからの操作を受け付ける入口を提供するため
 */
package com.streamraid.engine.api;

import com.streamraid.engine.api.response.ClaimRewardResponse;
import com.streamraid.engine.api.response.JoinRaidResponse;
import com.streamraid.engine.api.response.ParticipantProgressResponse;
import com.streamraid.engine.model.ClaimResult;
import com.streamraid.engine.model.ParticipantProgress;
import com.streamraid.engine.model.SettlementStatus;
import com.streamraid.engine.service.ClaimCoordinator;
import com.streamraid.engine.service.RaidParticipationService;
import com.streamraid.engine.session.SessionHandle;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/raids/{raidId}")
@RequiredArgsConstructor
public class RaidController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final RaidParticipationService participationService;
  private final ClaimCoordinator claimCoordinator;

  @PostMapping("/participants")
  public ResponseEntity<JoinRaidResponse> join(
      @PathVariable("raidId") UUID raidId, @RequestHeader(HEADER_USER_ID) String userId) {
    final SessionHandle handle = participationService.joinRaid(userId, raidId);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new JoinRaidResponse(
                handle.participantId(),
                handle.raidId().toString(),
                handle.trackId(),
                handle.platform().value(),
                handle.requiredSeconds(),
                handle.premiumTier(),
                handle.startedAt().toString()));
  }

  @DeleteMapping("/participants/me")
  public ResponseEntity<Void> leave(
      @PathVariable("raidId") UUID raidId, @RequestHeader(HEADER_USER_ID) String userId) {
    participationService.leaveRaid(userId, raidId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/participants/me/progress")
  public ResponseEntity<ParticipantProgressResponse> progress(
      @PathVariable("raidId") UUID raidId, @RequestHeader(HEADER_USER_ID) String userId) {
    final ParticipantProgress progress = participationService.getProgress(userId, raidId);
    final int percent =
        progress.qualified()
            ? 100
            : (int)
                Math.min(
                    100L,
                    (long) progress.totalListenDuration() * 100 / progress.requiredListenSeconds());
    return ResponseEntity.ok(
        new ParticipantProgressResponse(
            progress.participantId(),
            progress.raidId().toString(),
            progress.totalListenDuration(),
            progress.requiredListenSeconds(),
            percent,
            progress.listening(),
            progress.trackingActive(),
            progress.qualified(),
            progress.qualifiedAt() == null ? null : progress.qualifiedAt().toString(),
            progress.claimedReward(),
            progress.settlementStatus().name()));
  }

  /** 精算まで完了すれば 200、精算が保留なら 202 を返す。どちらも請求自体は確定済み。 */
  @PostMapping("/claims")
  public ResponseEntity<ClaimRewardResponse> claim(
      @PathVariable("raidId") UUID raidId, @RequestHeader(HEADER_USER_ID) String userId) {
    final ClaimResult result = claimCoordinator.claim(userId, raidId);
    final HttpStatus status =
        result.settlementStatus() == SettlementStatus.SETTLED
            ? HttpStatus.OK
            : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status)
        .body(
            new ClaimRewardResponse(
                result.participantId(),
                result.raidId().toString(),
                result.rewardAmount(),
                result.settlementStatus().name(),
                result.settlementReference()));
  }
}
