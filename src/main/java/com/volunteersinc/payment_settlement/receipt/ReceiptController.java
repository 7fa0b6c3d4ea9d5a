package com.volunteersinc.payment_settlement.receipt;

import com.volunteersinc.payment_settlement.payment.exception.InvalidRequestException;
import com.volunteersinc.payment_settlement.payment.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Receipt lookup for the receipts screen. A receipt number wins over an email.
 */
@RestController
@RequestMapping("/api/receipts")
@RequiredArgsConstructor
public class ReceiptController {

    static final int DEFAULT_LIMIT = 20;

    private final ReceiptIssuer receiptIssuer;

    @GetMapping
    public ResponseEntity<Map<String, Object>> find(
            @RequestParam(value = "email", required = false) String email,
            @RequestParam(value = "receiptNumber", required = false) String receiptNumber) {

        if (receiptNumber != null && !receiptNumber.isBlank()) {
            Receipt receipt = receiptIssuer.findByReceiptNumber(receiptNumber.trim())
                .orElseThrow(() -> new RecordNotFoundException("Receipt not found"));
            return ResponseEntity.ok(Map.of("receipt", receipt));
        }

        if (email != null && !email.isBlank()) {
            List<Receipt> receipts = receiptIssuer.findByCustomerEmail(email.trim(), DEFAULT_LIMIT);
            return ResponseEntity.ok(Map.of("receipts", receipts));
        }

        throw new InvalidRequestException("Email or receiptNumber required");
    }
}
