package io.github.drompincen.dispatchguard.runtime.validation;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;

import java.util.List;
import java.util.Map;

/**
 * Store data resolved ahead of validation so that {@link ContractValidator} stays pure.
 * A non-null {@code worksiteId} with a null {@code worksite} means the id did not resolve;
 * likewise a requested worker id missing from {@code workers}. Null worker ids are kept as
 * empty strings so they are reported rather than dropped.
 */
public record ValidationContext(
        String worksiteId,
        WorksiteDocument worksite,
        List<String> workerIds,
        Map<String, WorkerDocument> workers,
        Map<String, List<ContractDocument>> overlappingContracts
) {
    public ValidationContext {
        workerIds = workerIds != null
                ? workerIds.stream().map(id -> id != null ? id : "").toList()
                : List.of();
        workers = workers != null ? Map.copyOf(workers) : Map.of();
        overlappingContracts = overlappingContracts != null ? Map.copyOf(overlappingContracts) : Map.of();
    }

    public static ValidationContext none() {
        return new ValidationContext(null, null, List.of(), Map.of(), Map.of());
    }

    public static ValidationContext ofWorksite(WorksiteDocument worksite) {
        return new ValidationContext(worksite.getId(), worksite, List.of(), Map.of(), Map.of());
    }

    public List<ContractDocument> overlapsFor(String workerId) {
        return overlappingContracts.getOrDefault(workerId, List.of());
    }
}
