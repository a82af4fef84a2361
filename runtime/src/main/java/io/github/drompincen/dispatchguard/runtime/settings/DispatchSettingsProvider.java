package io.github.drompincen.dispatchguard.runtime.settings;

import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;

/** Agency-wide defaults for the dispatch-side (派遣元) blocks of a contract. */
public interface DispatchSettingsProvider {

    ContactInfo defaultDispatchManager();

    ContactInfo defaultDispatchComplaintContact();
}
