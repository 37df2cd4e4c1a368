package com.garageadmin.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class BusinessTimeConfig {

    // Entry/exit stamps and PDF "Generated" lines are in garage-local time
    @Bean
    public ZoneId garageZoneId(@Value("${garage.business.zone:Africa/Kigali}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock garageClock(ZoneId garageZoneId) {
        return Clock.system(garageZoneId);
    }
}
