package com.volunteersinc.payment_settlement.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock in the zone billing and membership dates are computed in.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${settlement.zone:America/Jamaica}") String zone) {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Settlement dates computed in zone {}", zoneId);
        return Clock.system(zoneId);
    }
}
