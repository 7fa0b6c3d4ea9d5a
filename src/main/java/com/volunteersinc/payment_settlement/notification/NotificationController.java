package com.volunteersinc.payment_settlement.notification;

import com.volunteersinc.payment_settlement.notification.dto.FanoutRequest;
import com.volunteersinc.payment_settlement.notification.dto.FanoutResponse;
import com.volunteersinc.payment_settlement.payment.exception.InvalidRequestException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationFanoutService fanoutService;

    @PostMapping("/fanout")
    public ResponseEntity<FanoutResponse> fanOut(@Valid @RequestBody FanoutRequest request) {
        NotificationCategory category;
        try {
            category = NotificationCategory.fromCode(request.getCategory());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("category must be one of cause, event, announcement");
        }

        FanoutResult result = fanoutService.fanOut(
            category,
            request.getRelatedId(),
            request.getActorId(),
            request.getTitle(),
            request.getBody()
        );
        return ResponseEntity.ok(FanoutResponse.from(result));
    }
}
