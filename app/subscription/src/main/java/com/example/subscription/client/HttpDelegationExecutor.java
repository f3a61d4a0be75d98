/*
 * どこで: Subscription クライアント層
 * 何を: デリゲーション実行サービスを HTTP で呼び出す
 * なぜ: 実行サービスの応答を型付きの失敗分類へ変換し、リトライ判定を呼び出し側に委ねるため
 */
package com.example.subscription.client;

import com.example.subscription.config.DelegationClientProperties;
import com.example.subscription.service.DelegationExecutor;
import com.example.subscription.service.DelegationRedemptionException;
import com.example.subscription.service.ExecutionParams;
import com.example.subscription.service.RedemptionFailureReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(
    name = "subscription.delegation.mode",
    havingValue = "http",
    matchIfMissing = true)
public class HttpDelegationExecutor implements DelegationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(HttpDelegationExecutor.class);
  private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  private final RestClient delegationRestClient;
  private final DelegationClientProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpDelegationExecutor(
      RestClient delegationRestClient,
      DelegationClientProperties properties,
      ObjectMapper objectMapper) {
    this.delegationRestClient = delegationRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public String redeem(byte[] delegationPayload, ExecutionParams params) {
    validate(delegationPayload, params);
    final DelegationRedeemRequest request =
        new DelegationRedeemRequest(
            delegationPayload,
            params.merchantAddress(),
            params.tokenContractAddress(),
            Long.toString(params.tokenAmount()),
            params.tokenDecimals(),
            params.chainId(),
            params.networkName());
    try {
      return requireTransactionHash(
          delegationRestClient
              .post()
              .uri(properties.redeemPath())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(DelegationRedeemResponse.class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (DelegationRedemptionException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("delegation response parse failed", ex);
      throw new DelegationRedemptionException(
          RedemptionFailureReason.TRANSIENT, "delegation response parse failed", ex);
    }
  }

  private String requireTransactionHash(DelegationRedeemResponse response) {
    if (response == null || isBlank(response.transactionHash())) {
      throw new DelegationRedemptionException(
          RedemptionFailureReason.TRANSIENT, "delegation response has no transaction hash");
    }
    return response.transactionHash();
  }

  private DelegationRedemptionException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    final String body = ex.getResponseBodyAsString();
    final DelegationErrorResponse error = parseError(body);
    final String message = errorMessage(status, body, error);
    final RedemptionFailureReason reason = classify(status, error, message);
    logger.warn(
        "delegation redeem failed with http status={} errorCode={} reason={}",
        status,
        error == null ? null : error.errorCode(),
        reason);
    return new DelegationRedemptionException(reason, message, ex);
  }

  // エラーコード → メッセージの既知文言 → HTTP ステータスの順で判定する
  private RedemptionFailureReason classify(
      int status, DelegationErrorResponse error, String message) {
    final Optional<RedemptionFailureReason> byCode =
        error == null ? Optional.empty() : RedemptionFailureReason.parseCode(error.errorCode());
    if (byCode.isPresent()) {
      return byCode.get();
    }
    final Optional<RedemptionFailureReason> byMessage =
        RedemptionFailureReason.fromMessage(message);
    if (byMessage.isPresent()) {
      return byMessage.get();
    }
    if (status == 401 || status == 403) {
      return RedemptionFailureReason.UNAUTHORIZED;
    }
    return RedemptionFailureReason.TRANSIENT;
  }

  private String errorMessage(int status, String body, DelegationErrorResponse error) {
    if (error != null && !isBlank(error.message())) {
      return error.message();
    }
    if (error != null && !isBlank(error.errorCode())) {
      return error.errorCode();
    }
    if (error == null && !isBlank(body)) {
      return body.trim();
    }
    return "delegation executor rejected request status=" + status;
  }

  private DelegationRedemptionException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("delegation redeem timed out");
      return new DelegationRedemptionException(
          RedemptionFailureReason.TIMEOUT, "delegation request timeout", ex);
    }
    logger.warn("delegation redeem connection failed", ex);
    return new DelegationRedemptionException(
        RedemptionFailureReason.TRANSIENT, "delegation connection failed", ex);
  }

  private DelegationErrorResponse parseError(String body) {
    if (isBlank(body)) {
      return null;
    }
    try {
      return objectMapper.readValue(body, DelegationErrorResponse.class);
    } catch (JsonProcessingException ex) {
      logger.debug("delegation error body is not json", ex);
      return null;
    }
  }

  // 送信前に明らかな不備を弾き、リトライ枠を浪費しない
  private void validate(byte[] delegationPayload, ExecutionParams params) {
    if (delegationPayload == null || delegationPayload.length == 0) {
      throw invalid("delegation payload is required");
    }
    if (isBlank(params.merchantAddress()) || ZERO_ADDRESS.equals(params.merchantAddress())) {
      throw invalid("merchant address is required");
    }
    if (isBlank(params.tokenContractAddress())
        || ZERO_ADDRESS.equals(params.tokenContractAddress())) {
      throw invalid("token contract address is required");
    }
    if (params.tokenAmount() <= 0) {
      throw invalid("token amount must be positive");
    }
    if (params.tokenDecimals() <= 0) {
      throw invalid("token decimals must be positive");
    }
    if (params.chainId() <= 0) {
      throw invalid("chain id must be positive");
    }
    if (isBlank(params.networkName())) {
      throw invalid("network name is required");
    }
  }

  private DelegationRedemptionException invalid(String message) {
    return new DelegationRedemptionException(RedemptionFailureReason.INVALID_REQUEST, message);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
