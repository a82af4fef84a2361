package io.github.drompincen.dispatchguard.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/** Business dates ("today", cutoff and expiry windows) are evaluated in the configured zone. */
@Configuration
public class ClockConfig {

    @Bean
    Clock clock(@Value("${dispatchguard.zone:Asia/Tokyo}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
