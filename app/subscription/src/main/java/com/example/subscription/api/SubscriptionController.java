/*
 * どこで: Subscription API
 * 何を: 請求実行と参照のエンドポイントを提供する
 * なぜ: 外部スケジューラや運用者がバッチ/単発の請求を起動できるようにするため
 */
package com.example.subscription.api;

import com.example.subscription.service.ProcessResult;
import com.example.subscription.service.RedemptionResult;
import com.example.subscription.service.SubscriptionRedemptionService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/subscriptions")
@RequiredArgsConstructor
@Validated
public class SubscriptionController {

  private final SubscriptionRedemptionService redemptionService;

  @PostMapping("/{id}/redeem")
  public SingleRedemptionResponse redeem(@PathVariable("id") UUID subscriptionId) {
    final ProcessResult result = redemptionService.redeem(subscriptionId);
    return SingleRedemptionResponse.from(subscriptionId, result);
  }

  @PostMapping("/process-due")
  public RedemptionResult processDue() {
    return redemptionService.processDue();
  }

  @PostMapping("/redeem-due")
  public RedemptionResult redeemDue(
      @Valid @RequestBody(required = false) RedeemDueRequest request) {
    return redemptionService.redeemDue(request == null ? null : request.subscriptionIds());
  }

  @GetMapping("/{id}")
  public SubscriptionResponse get(@PathVariable("id") UUID subscriptionId) {
    return SubscriptionResponse.from(redemptionService.getSubscription(subscriptionId));
  }

  @GetMapping("/{id}/events")
  public SubscriptionEventsResponse events(@PathVariable("id") UUID subscriptionId) {
    return new SubscriptionEventsResponse(
        subscriptionId,
        redemptionService.listEvents(subscriptionId).stream()
            .map(SubscriptionEventSummary::from)
            .toList());
  }
}
