/*
 * どこで: Raid Engine データアクセス
 * 何を: platform_authorizations の参照/保存を担う
 * なぜ: 参加者ごとの連携アカウントとアクセストークンを再生確認で使うため
 */
package com.streamraid.engine.repository;

import static com.streamraid.common.JdbcTimestampUtils.getInstant;
import static com.streamraid.common.JdbcTimestampUtils.toTimestamp;

import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.PlatformAuthorizationRecord;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PlatformAuthorizationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<PlatformAuthorizationRecord> find(String participantId, Platform platform) {
    final String sql =
        """
        SELECT participant_id, platform, platform_user_id, access_token, premium,
               expires_at, updated_at
        FROM platform_authorizations
        WHERE participant_id = :participantId
          AND platform = :platform
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("participantId", participantId)
            .addValue("platform", platform.name());
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new PlatformAuthorizationRecord(
                    rs.getString("participant_id"),
                    Platform.valueOf(rs.getString("platform")),
                    rs.getString("platform_user_id"),
                    rs.getString("access_token"),
                    rs.getBoolean("premium"),
                    getInstant(rs, "expires_at"),
                    getInstant(rs, "updated_at")))
        .stream()
        .findFirst();
  }

  public void upsert(PlatformAuthorizationRecord record) {
    final String sql =
        """
        INSERT INTO platform_authorizations (
          participant_id, platform, platform_user_id, access_token, premium, expires_at, updated_at
        ) VALUES (
          :participantId, :platform, :platformUserId, :accessToken, :premium, :expiresAt, :updatedAt
        )
        ON CONFLICT (participant_id, platform) DO UPDATE
        SET platform_user_id = EXCLUDED.platform_user_id,
            access_token = EXCLUDED.access_token,
            premium = EXCLUDED.premium,
            expires_at = EXCLUDED.expires_at,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("participantId", record.participantId())
            .addValue("platform", record.platform().name())
            .addValue("platformUserId", record.platformUserId())
            .addValue("accessToken", record.accessToken())
            .addValue("premium", record.premium())
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }
}
