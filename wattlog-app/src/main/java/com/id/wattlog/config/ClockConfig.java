package com.id.wattlog.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class ClockConfig {

    /**
     * Wall clock used for "now" and for calendar bucket alignment. Falls back to the
     * system zone when {@code wattlog.zone-id} is blank.
     */
    @Bean
    public Clock clock(AppConfig appConfig) {
        String zoneId = appConfig.getZoneId();
        ZoneId zone = (zoneId == null || zoneId.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zoneId.trim());
        log.info("Using zone {} for bucket alignment", zone);
        return Clock.system(zone);
    }
}
