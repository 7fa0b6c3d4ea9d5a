package com.volunteersinc.payment_settlement.payment;

import com.volunteersinc.payment_settlement.payment.dto.ConfirmPaymentRequest;
import com.volunteersinc.payment_settlement.payment.dto.ConfirmationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment confirmations. Duplicate confirmations are answered
 * with success; the ledger is only ever settled once.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationController {

    private final PaymentConfirmationService confirmationService;

    @PostMapping("/confirm")
    public ResponseEntity<ConfirmationResponse> confirm(@RequestBody ConfirmPaymentRequest request) {
        log.debug("Received payment confirmation: transactionId={}, subscriptionId={}",
                request.getTransactionId(), request.getSubscriptionId());

        ConfirmationResult result = confirmationService.confirm(
            request.getTransactionId(),
            request.getSubscriptionId(),
            request.getTransactionNumber()
        );
        return ResponseEntity.ok(ConfirmationResponse.from(result));
    }
}
