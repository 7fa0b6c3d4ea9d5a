package com.volunteersinc.payment_settlement.notification;

import com.volunteersinc.payment_settlement.settlement.SecondaryFailure;
import lombok.Value;

import java.util.List;

@Value
public class FanoutResult {
    int recipients;
    int pushed;
    List<SecondaryFailure> pushFailures;

    public int getPushFailureCount() {
        return pushFailures.size();
    }
}
