package io.github.drompincen.dispatchguard.app.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.TimeZone;

/**
 * Mapper shared by the sync layer to turn documents into snapshot maps and back.
 * Reads by field so documents round-trip without getters, writes ISO dates, and ignores
 * fields that older snapshots carry but the current documents no longer declare.
 */
@Configuration
public class JacksonConfig {

    @Bean
    ObjectMapper objectMapper(Clock clock) {
        return new ObjectMapper()
                .findAndRegisterModules()
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .setTimeZone(TimeZone.getTimeZone(clock.getZone()))
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
