package io.github.drompincen.dispatchguard.runtime.validation;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.persistence.repository.ContractRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorksiteRepository;
import io.github.drompincen.dispatchguard.persistence.repository.WorkerRepository;
import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import io.github.drompincen.dispatchguard.protocol.api.ValidationResult;
import io.github.drompincen.dispatchguard.protocol.api.ValidationSummary;
import io.github.drompincen.dispatchguard.runtime.settings.DispatchSettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Store-backed front of {@link ContractValidator}: resolves the worksite, workers and
 * overlapping contracts a contract refers to, then validates.
 */
@Service
public class ContractValidationService {

    private static final Logger log = LoggerFactory.getLogger(ContractValidationService.class);

    static final List<ContractStatus> OVERLAP_STATUSES = List.of(ContractStatus.ACTIVE, ContractStatus.DRAFT);

    private final ContractValidator validator;
    private final ContractRepository contractRepository;
    private final WorksiteRepository worksiteRepository;
    private final WorkerRepository workerRepository;
    private final DispatchSettingsProvider settingsProvider;

    public ContractValidationService(ContractValidator validator,
                                     ContractRepository contractRepository,
                                     WorksiteRepository worksiteRepository,
                                     WorkerRepository workerRepository,
                                     DispatchSettingsProvider settingsProvider) {
        this.validator = validator;
        this.contractRepository = contractRepository;
        this.worksiteRepository = worksiteRepository;
        this.workerRepository = workerRepository;
        this.settingsProvider = settingsProvider;
    }

    public ValidationResult validateExisting(String contractId) {
        return contractRepository.findById(contractId)
                .map(this::validate)
                .orElseGet(() -> ContractValidator.notFound(contractId));
    }

    /** Validates an already loaded contract against its stored worksite and workers. */
    public ValidationResult validate(ContractDocument contract) {
        return validator.validate(contract,
                resolveContext(contract, contract.getWorksiteId(), contract.getWorkerIds()));
    }

    /**
     * Validates a contract that has not been persisted yet. Empty dispatch-side manager and
     * complaint blocks are filled from the agency defaults first, as creation would.
     */
    public ValidationResult validateDraft(ContractDocument draft, String worksiteId, List<String> workerIds) {
        applyDispatchDefaults(draft);
        ValidationResult result = validator.validate(draft, resolveContext(draft, worksiteId, workerIds));
        log.debug("Draft validation: valid={} errors={} warnings={} score={}",
                result.valid(), result.errorCount(), result.warningCount(), result.score());
        return result;
    }

    public ValidationSummary summarize(String contractId) {
        ContractDocument contract = contractRepository.findById(contractId).orElse(null);
        if (contract == null) {
            ValidationResult result = ContractValidator.notFound(contractId);
            return new ValidationSummary(contractId, null, null, result,
                    ValidationSummary.ValidationStatus.INVALID, recommendation(result));
        }
        ValidationResult result = validate(contract);
        return new ValidationSummary(contractId, contract.getContractNumber(), contract.getWorksiteName(), result,
                result.valid() ? ValidationSummary.ValidationStatus.VALID : ValidationSummary.ValidationStatus.INVALID,
                recommendation(result));
    }

    public void applyDispatchDefaults(ContractDocument draft) {
        if (isUnset(draft.getDispatchManager())) {
            draft.setDispatchManager(settingsProvider.defaultDispatchManager());
        }
        if (isUnset(draft.getDispatchComplaintContact())) {
            draft.setDispatchComplaintContact(settingsProvider.defaultDispatchComplaintContact());
        }
    }

    ValidationContext resolveContext(ContractDocument contract, String worksiteId, List<String> workerIds) {
        WorksiteDocument worksite = isBlank(worksiteId) ? null : worksiteRepository.findById(worksiteId).orElse(null);

        Map<String, WorkerDocument> workers = new HashMap<>();
        Map<String, List<ContractDocument>> overlaps = new HashMap<>();
        if (workerIds != null) {
            for (String workerId : workerIds) {
                // blank ids stay unresolved and surface as WORKER_NOT_FOUND
                if (isBlank(workerId)) continue;
                workerRepository.findById(workerId).ifPresent(w -> workers.put(workerId, w));
                if (contract.getDispatchStartDate() != null && contract.getDispatchEndDate() != null) {
                    List<ContractDocument> others = contractRepository.findOverlapping(workerId,
                                    contract.getDispatchStartDate(), contract.getDispatchEndDate(), OVERLAP_STATUSES)
                            .stream()
                            .filter(c -> contract.getId() == null || !Objects.equals(c.getId(), contract.getId()))
                            .toList();
                    if (!others.isEmpty()) {
                        overlaps.put(workerId, others);
                    }
                }
            }
        }
        return new ValidationContext(worksiteId, worksite, workerIds, workers, overlaps);
    }

    static String recommendation(ValidationResult result) {
        if (result.valid() && result.warningCount() == 0) {
            return "Contract is fully compliant.";
        }
        if (result.valid()) {
            return "Contract is valid with " + result.warningCount() + " improvement(s) suggested.";
        }
        return "Fix " + result.errorCount() + " error(s) before issuing the contract.";
    }

    private static boolean isBlank(String id) {
        return id == null || id.isBlank();
    }

    private static boolean isUnset(ContactInfo contact) {
        return contact == null || contact.isEmpty();
    }
}
