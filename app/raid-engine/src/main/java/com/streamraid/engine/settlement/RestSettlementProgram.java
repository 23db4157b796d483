/*
 * どこで: Raid Engine 精算
 * 何を: 外部の精算サービスへ HTTP で送金を依頼する
 * なぜ: 冪等キー付きで送金し、失敗を再試行可能な例外へ一貫変換するため
 */
package com.streamraid.engine.settlement;

import com.streamraid.engine.config.SettlementProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "raid.settlement.mode", havingValue = "rest")
public class RestSettlementProgram implements SettlementProgram {

  private static final Logger logger = LoggerFactory.getLogger(RestSettlementProgram.class);
  static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient settlementRestClient;

  private final SettlementProperties properties;

  public RestSettlementProgram(
      @Qualifier("settlementRestClient") RestClient settlementRestClient,
      SettlementProperties properties) {
    this.settlementRestClient = settlementRestClient;
    this.properties = properties;
  }

  @Override
  public String settle(String participantId, UUID raidId, BigDecimal amount) {
    final SettleResponse response;
    try {
      response =
          settlementRestClient
              .post()
              .uri(properties.settlePath())
              .header(HEADER_IDEMPOTENCY_KEY, participantId + ":" + raidId)
              .body(new SettleRequest(participantId, raidId.toString(), amount))
              .retrieve()
              .body(SettleResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "settlement failed with http status={} participantId={} raidId={}",
          ex.getStatusCode().value(),
          participantId,
          raidId);
      throw new SettlementUnavailableException(
          "settlement request failed status=" + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      logger.warn("settlement unreachable participantId={} raidId={}", participantId, raidId);
      throw new SettlementUnavailableException("settlement connection failed", ex);
    } catch (RuntimeException ex) {
      logger.warn("settlement response parse failed", ex);
      throw new SettlementUnavailableException("settlement response parse failed", ex);
    }
    if (response == null
        || response.transactionReference() == null
        || response.transactionReference().isBlank()) {
      throw new SettlementUnavailableException("settlement response has no reference");
    }
    return response.transactionReference();
  }
}
