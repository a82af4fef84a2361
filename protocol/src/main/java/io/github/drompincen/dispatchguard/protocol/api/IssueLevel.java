package io.github.drompincen.dispatchguard.protocol.api;

/** ERROR blocks a contract from being valid; WARNING is advisory. */
public enum IssueLevel {
    ERROR, WARNING
}
