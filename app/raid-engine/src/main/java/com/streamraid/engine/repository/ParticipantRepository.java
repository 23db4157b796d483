/*
 * どこで: Raid Engine データアクセス
 * 何を: raid_participants の参加/進捗/資格/請求/精算/通知状態を読み書きする
 * なぜ: 請求の一回性と資格の単調性を SQL の条件付き更新で保証するため
 */
package com.streamraid.engine.repository;

import static com.streamraid.common.JdbcTimestampUtils.getInstant;
import static com.streamraid.common.JdbcTimestampUtils.toTimestamp;

import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.PendingSettlement;
import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.RecoverableSession;
import com.streamraid.engine.model.SettlementStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ParticipantRepository {

  private static final String RETURNING_COLUMNS =
      """
      participant_id, raid_id, is_listening, total_listen_duration, last_checked_at,
      tracking_active, qualified, qualified_at, claimed_reward, claimed_at,
      claim_tx_reference, settlement_status, settlement_attempts, settlement_next_retry_at,
      last_notification_message_ref, last_notified_at, joined_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ParticipantRecord> find(String participantId, UUID raidId) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + " FROM raid_participants WHERE participant_id = :participantId AND raid_id = :raidId";
    return jdbcTemplate.query(sql, key(participantId, raidId), this::mapRow).stream().findFirst();
  }

  public List<ParticipantRecord> findQualified(UUID raidId) {
    final String sql =
        "SELECT "
            + RETURNING_COLUMNS
            + " FROM raid_participants WHERE raid_id = :raidId AND qualified = TRUE"
            + " ORDER BY qualified_at";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("raidId", raidId), this::mapRow);
  }

  /**
   * 参加を登録する。既存行は資格未取得の場合だけ進捗をリセットして追跡を再開する。
   *
   * @return 登録/再開した行。既に資格取得済みなら empty
   */
  public Optional<ParticipantRecord> upsertJoin(String participantId, UUID raidId, Instant now) {
    final String sql =
        """
        INSERT INTO raid_participants (
          participant_id, raid_id, is_listening, total_listen_duration, last_checked_at,
          tracking_active, joined_at
        ) VALUES (
          :participantId, :raidId, FALSE, 0, :now, TRUE, :now
        )
        ON CONFLICT (participant_id, raid_id) DO UPDATE
        SET is_listening = FALSE,
            total_listen_duration = 0,
            last_checked_at = :now,
            tracking_active = TRUE
        WHERE raid_participants.qualified = FALSE
        RETURNING
        """
            + RETURNING_COLUMNS;
    return jdbcTemplate
        .query(sql, key(participantId, raidId).addValue("now", toTimestamp(now)), this::mapRow)
        .stream()
        .findFirst();
  }

  /** 資格取得済みの行と、ACTIVE でない/期限切れの raid の行は更新しない。 */
  public int updateProgress(
      String participantId, UUID raidId, boolean listening, int totalSeconds, Instant checkedAt) {
    final String sql =
        """
        UPDATE raid_participants
        SET is_listening = :listening,
            total_listen_duration = :totalSeconds,
            last_checked_at = :checkedAt
        WHERE participant_id = :participantId
          AND raid_id = :raidId
          AND qualified = FALSE
          AND EXISTS (
            SELECT 1 FROM raids r
            WHERE r.raid_id = :raidId
              AND r.status = 'ACTIVE'
              AND r.expires_at >= :checkedAt
          )
        """;
    final MapSqlParameterSource params =
        key(participantId, raidId)
            .addValue("listening", listening)
            .addValue("totalSeconds", totalSeconds)
            .addValue("checkedAt", toTimestamp(checkedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * qualified は false から true へ一度だけ遷移する。
   *
   * <p>raid が ACTIVE かつ qualifiedAt 時点で期限内の場合だけ更新する。
   */
  public int markQualified(
      String participantId, UUID raidId, int totalSeconds, Instant qualifiedAt) {
    final String sql =
        """
        UPDATE raid_participants
        SET qualified = TRUE,
            qualified_at = :qualifiedAt,
            is_listening = FALSE,
            total_listen_duration = :totalSeconds,
            last_checked_at = :qualifiedAt,
            tracking_active = FALSE
        WHERE participant_id = :participantId
          AND raid_id = :raidId
          AND qualified = FALSE
          AND EXISTS (
            SELECT 1 FROM raids r
            WHERE r.raid_id = :raidId
              AND r.status = 'ACTIVE'
              AND r.expires_at >= :qualifiedAt
          )
        """;
    final MapSqlParameterSource params =
        key(participantId, raidId)
            .addValue("totalSeconds", totalSeconds)
            .addValue("qualifiedAt", toTimestamp(qualifiedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int stopTracking(String participantId, UUID raidId, Instant checkedAt) {
    final String sql =
        """
        UPDATE raid_participants
        SET is_listening = FALSE,
            tracking_active = FALSE,
            last_checked_at = :checkedAt
        WHERE participant_id = :participantId
          AND raid_id = :raidId
        """;
    return jdbcTemplate.update(
        sql, key(participantId, raidId).addValue("checkedAt", toTimestamp(checkedAt)));
  }

  public int stopTrackingForRaid(UUID raidId, Instant checkedAt) {
    final String sql =
        """
        UPDATE raid_participants
        SET is_listening = FALSE,
            tracking_active = FALSE,
            last_checked_at = :checkedAt
        WHERE raid_id = :raidId
          AND tracking_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("raidId", raidId)
            .addValue("checkedAt", toTimestamp(checkedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 請求フラグを条件付きで立て、同じ文で精算リースを取得する。
   *
   * <p>同時に何件呼ばれても行を返すのは最初の 1 件だけ。
   */
  public Optional<ParticipantRecord> claimReward(
      String participantId, UUID raidId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE raid_participants
        SET claimed_reward = TRUE,
            claimed_at = :now,
            settlement_status = 'PROCESSING',
            settlement_locked_by = :lockedBy,
            settlement_lease_until = :leaseUntil,
            tracking_active = FALSE,
            is_listening = FALSE
        WHERE participant_id = :participantId
          AND raid_id = :raidId
          AND qualified = TRUE
          AND claimed_reward = FALSE
        RETURNING
        """
            + RETURNING_COLUMNS;
    final MapSqlParameterSource params =
        key(participantId, raidId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markSettled(String participantId, UUID raidId, String reference, String lockedBy) {
    final String sql =
        """
        UPDATE raid_participants
        SET settlement_status = 'SETTLED',
            claim_tx_reference = :reference,
            settlement_next_retry_at = NULL,
            settlement_locked_by = NULL,
            settlement_lease_until = NULL
        WHERE participant_id = :participantId
          AND raid_id = :raidId
          AND settlement_status = 'PROCESSING'
          AND settlement_locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        key(participantId, raidId).addValue("reference", reference).addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int markSettlementRetry(
      String participantId, UUID raidId, int attempts, Instant nextRetryAt, String lockedBy) {
    final String sql =
        """
        UPDATE raid_participants
        SET settlement_status = 'PENDING',
            settlement_attempts = :attempts,
            settlement_next_retry_at = :nextRetryAt,
            settlement_locked_by = NULL,
            settlement_lease_until = NULL
        WHERE participant_id = :participantId
          AND raid_id = :raidId
          AND settlement_status = 'PROCESSING'
          AND settlement_locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        key(participantId, raidId)
            .addValue("attempts", attempts)
            .addValue("nextRetryAt", toTimestamp(nextRetryAt))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public List<PendingSettlement> claimPendingSettlements(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING と lease 切れの PROCESSING をまとめて claim し、競合を避ける
    final String sql =
        """
        WITH cte AS (
          SELECT participant_id, raid_id
          FROM raid_participants
          WHERE claimed_reward = TRUE
            AND (
              (
                settlement_status = 'PENDING'
                AND (settlement_next_retry_at IS NULL OR settlement_next_retry_at <= :now)
              )
              OR (
                settlement_status = 'PROCESSING'
                AND (settlement_lease_until IS NULL OR settlement_lease_until <= :now)
              )
            )
          ORDER BY claimed_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE raid_participants p
        SET settlement_status = 'PROCESSING',
            settlement_locked_by = :lockedBy,
            settlement_lease_until = :leaseUntil
        FROM cte, raids r
        WHERE p.participant_id = cte.participant_id
          AND p.raid_id = cte.raid_id
          AND r.raid_id = p.raid_id
        RETURNING p.participant_id, p.raid_id, r.reward_amount, p.settlement_attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new PendingSettlement(
                rs.getString("participant_id"),
                UUID.fromString(rs.getString("raid_id")),
                rs.getBigDecimal("reward_amount"),
                rs.getInt("settlement_attempts")));
  }

  public List<RecoverableSession> findRecoverable(Instant now) {
    final String sql =
        """
        SELECT p.participant_id, p.raid_id, r.track_id, r.platform, r.required_listen_seconds,
               r.expires_at, p.is_listening, p.total_listen_duration
        FROM raid_participants p
        JOIN raids r ON r.raid_id = p.raid_id
        WHERE p.tracking_active = TRUE
          AND p.qualified = FALSE
          AND r.status = 'ACTIVE'
          AND r.expires_at >= :now
        ORDER BY p.joined_at
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("now", toTimestamp(now)),
        (rs, rowNum) ->
            new RecoverableSession(
                rs.getString("participant_id"),
                UUID.fromString(rs.getString("raid_id")),
                rs.getString("track_id"),
                Platform.valueOf(rs.getString("platform")),
                rs.getInt("required_listen_seconds"),
                getInstant(rs, "expires_at"),
                rs.getBoolean("is_listening"),
                rs.getInt("total_listen_duration")));
  }

  public int updateNotification(
      String participantId, UUID raidId, String messageRef, Instant notifiedAt) {
    final String sql =
        """
        UPDATE raid_participants
        SET last_notification_message_ref = :messageRef,
            last_notified_at = :notifiedAt
        WHERE participant_id = :participantId
          AND raid_id = :raidId
        """;
    final MapSqlParameterSource params =
        key(participantId, raidId)
            .addValue("messageRef", messageRef)
            .addValue("notifiedAt", toTimestamp(notifiedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** 一度も再生が確認されず追跡も止まった未資格の参加者を削除する。 */
  public int deleteStaleJoiners(Instant joinedBefore) {
    final String sql =
        """
        DELETE FROM raid_participants p
        USING raids r
        WHERE r.raid_id = p.raid_id
          AND r.status = 'ACTIVE'
          AND p.qualified = FALSE
          AND p.tracking_active = FALSE
          AND p.total_listen_duration = 0
          AND p.joined_at < :joinedBefore
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("joinedBefore", toTimestamp(joinedBefore)));
  }

  private MapSqlParameterSource key(String participantId, UUID raidId) {
    return new MapSqlParameterSource()
        .addValue("participantId", participantId)
        .addValue("raidId", raidId);
  }

  private ParticipantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ParticipantRecord(
        rs.getString("participant_id"),
        UUID.fromString(rs.getString("raid_id")),
        rs.getBoolean("is_listening"),
        rs.getInt("total_listen_duration"),
        getInstant(rs, "last_checked_at"),
        rs.getBoolean("tracking_active"),
        rs.getBoolean("qualified"),
        getInstant(rs, "qualified_at"),
        rs.getBoolean("claimed_reward"),
        getInstant(rs, "claimed_at"),
        rs.getString("claim_tx_reference"),
        SettlementStatus.valueOf(rs.getString("settlement_status")),
        rs.getInt("settlement_attempts"),
        getInstant(rs, "settlement_next_retry_at"),
        rs.getString("last_notification_message_ref"),
        getInstant(rs, "last_notified_at"),
        getInstant(rs, "joined_at"));
  }
}
