package io.github.drompincen.dispatchguard.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/** Last issued contract sequence per month, keyed by {@code yyyyMM}. */
@Document(collection = "contract_number_counters")
public class ContractNumberCounterDocument {

    @Id
    private String yearMonth;
    private int lastSequence;
    private Instant updatedAt;

    public ContractNumberCounterDocument() {}

    public String getYearMonth() { return yearMonth; }
    public void setYearMonth(String yearMonth) { this.yearMonth = yearMonth; }

    public int getLastSequence() { return lastSequence; }
    public void setLastSequence(int lastSequence) { this.lastSequence = lastSequence; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
