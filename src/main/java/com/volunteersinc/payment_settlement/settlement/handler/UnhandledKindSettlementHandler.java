package com.volunteersinc.payment_settlement.settlement.handler;

import com.volunteersinc.payment_settlement.settlement.DomainEffect;
import com.volunteersinc.payment_settlement.settlement.SettlementContext;
import com.volunteersinc.payment_settlement.settlement.SettlementHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Categories with no domain record attached. The ledger update alone is
 * the settlement.
 */
@Component
@Slf4j
public class UnhandledKindSettlementHandler implements SettlementHandler {

    @Override
    public DomainEffect settle(SettlementContext context) {
        log.info("No specific handling for payment kind: kind={}, recordId={}",
                context.getKind(), context.getRecordId());
        return DomainEffect.skipped("no handling for " + context.getKind());
    }
}
