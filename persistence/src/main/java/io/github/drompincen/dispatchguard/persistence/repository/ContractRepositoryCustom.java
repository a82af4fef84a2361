package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.protocol.api.AuditScope;

import java.util.List;

public interface ContractRepositoryCustom {

    /** Contracts matching every non-null filter of the scope, ordered by contract number. */
    List<ContractDocument> findInScope(AuditScope scope);
}
