package io.github.drompincen.dispatchguard.runtime.settings;

import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import org.springframework.stereotype.Component;

@Component
public class PropertiesDispatchSettingsProvider implements DispatchSettingsProvider {

    private final DispatchDefaultsProperties properties;

    public PropertiesDispatchSettingsProvider(DispatchDefaultsProperties properties) {
        this.properties = properties;
    }

    @Override
    public ContactInfo defaultDispatchManager() {
        return properties.dispatchManager();
    }

    @Override
    public ContactInfo defaultDispatchComplaintContact() {
        return properties.dispatchComplaintContact();
    }
}
