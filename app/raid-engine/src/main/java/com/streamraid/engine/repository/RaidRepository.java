/*
 * どこで: Raid Engine データアクセス
 * 何を: raids テーブルの登録/取得/状態遷移を担う
 * なぜ: 完了と期限切れを単一 SQL の条件付き更新で一度だけ確定させるため
 */
package com.streamraid.engine.repository;

import static com.streamraid.common.JdbcTimestampUtils.getInstant;
import static com.streamraid.common.JdbcTimestampUtils.toTimestamp;

import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.model.RaidStatus;
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
public class RaidRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT raid_id, track_id, platform, required_listen_seconds, participant_goal,
             max_participants, reward_amount, premium_only, status, expires_at,
             created_at, completed_at
      FROM raids
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(RaidRecord record) {
    final String sql =
        """
        INSERT INTO raids (
          raid_id,
          track_id,
          platform,
          required_listen_seconds,
          participant_goal,
          max_participants,
          reward_amount,
          premium_only,
          status,
          expires_at,
          created_at,
          completed_at
        ) VALUES (
          :raidId,
          :trackId,
          :platform,
          :requiredListenSeconds,
          :participantGoal,
          :maxParticipants,
          :rewardAmount,
          :premiumOnly,
          :status,
          :expiresAt,
          :createdAt,
          :completedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("raidId", record.raidId())
            .addValue("trackId", record.trackId())
            .addValue("platform", record.platform().name())
            .addValue("requiredListenSeconds", record.requiredListenSeconds())
            .addValue("participantGoal", record.participantGoal())
            .addValue("maxParticipants", record.maxParticipants())
            .addValue("rewardAmount", record.rewardAmount())
            .addValue("premiumOnly", record.premiumOnly())
            .addValue("status", record.status().name())
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("completedAt", toTimestamp(record.completedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<RaidRecord> findById(UUID raidId) {
    final String sql = SELECT_COLUMNS + "WHERE raid_id = :raidId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("raidId", raidId), this::mapRow)
        .stream()
        .findFirst();
  }

  /** 呼び出し側トランザクションの間だけ raid 行をロックする。定員判定の直列化に使う。 */
  public Optional<RaidRecord> lockById(UUID raidId) {
    final String sql = SELECT_COLUMNS + "WHERE raid_id = :raidId FOR UPDATE";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("raidId", raidId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<UUID> findActiveRaidIds(Instant now) {
    final String sql =
        """
        SELECT raid_id
        FROM raids
        WHERE status = 'ACTIVE'
          AND expires_at >= :now
        ORDER BY created_at
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("now", toTimestamp(now)),
        (rs, rowNum) -> UUID.fromString(rs.getString("raid_id")));
  }

  public int countParticipants(UUID raidId) {
    final String sql = "SELECT COUNT(*) FROM raid_participants WHERE raid_id = :raidId";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("raidId", raidId), Integer.class);
    return count == null ? 0 : count;
  }

  public int countQualified(UUID raidId) {
    final String sql =
        "SELECT COUNT(*) FROM raid_participants WHERE raid_id = :raidId AND qualified = TRUE";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("raidId", raidId), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * 資格者数が目標に達していれば ACTIVE から COMPLETED へ遷移させる。
   *
   * <p>同時に呼ばれても行ロック後に WHERE が再評価されるため、true を返すのは 1 呼び出しだけ。
   */
  public boolean completeIfGoalReached(UUID raidId, Instant now) {
    final String sql =
        """
        UPDATE raids r
        SET status = 'COMPLETED',
            completed_at = :now
        WHERE r.raid_id = :raidId
          AND r.status = 'ACTIVE'
          AND r.expires_at >= :now
          AND (
            SELECT COUNT(*)
            FROM raid_participants p
            WHERE p.raid_id = r.raid_id
              AND p.qualified = TRUE
          ) >= r.participant_goal
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("raidId", raidId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public List<UUID> expireOverdue(Instant now) {
    final String sql =
        """
        UPDATE raids
        SET status = 'EXPIRED'
        WHERE status = 'ACTIVE'
          AND expires_at < :now
        RETURNING raid_id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("now", toTimestamp(now)),
        (rs, rowNum) -> UUID.fromString(rs.getString("raid_id")));
  }

  private RaidRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int rawMaxParticipants = rs.getInt("max_participants");
    final Integer maxParticipants = rs.wasNull() ? null : rawMaxParticipants;
    return new RaidRecord(
        UUID.fromString(rs.getString("raid_id")),
        rs.getString("track_id"),
        Platform.valueOf(rs.getString("platform")),
        rs.getInt("required_listen_seconds"),
        rs.getInt("participant_goal"),
        maxParticipants,
        rs.getBigDecimal("reward_amount"),
        rs.getBoolean("premium_only"),
        RaidStatus.valueOf(rs.getString("status")),
        getInstant(rs, "expires_at"),
        getInstant(rs, "created_at"),
        getInstant(rs, "completed_at"));
  }
}
