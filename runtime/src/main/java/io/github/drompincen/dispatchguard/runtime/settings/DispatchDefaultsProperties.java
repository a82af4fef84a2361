package io.github.drompincen.dispatchguard.runtime.settings;

import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Bound from {@code dispatchguard.defaults.*}. */
@ConfigurationProperties(prefix = "dispatchguard.defaults")
public record DispatchDefaultsProperties(
        ContactInfo dispatchManager,
        ContactInfo dispatchComplaintContact
) {
}
