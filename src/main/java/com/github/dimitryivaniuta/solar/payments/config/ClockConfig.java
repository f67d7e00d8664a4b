package com.github.dimitryivaniuta.solar.payments.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock in the business zone, so "today" for due dates does not depend on the host time zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(AppProperties props) {
        return Clock.system(ZoneId.of(props.getPayments().getZone()));
    }
}
