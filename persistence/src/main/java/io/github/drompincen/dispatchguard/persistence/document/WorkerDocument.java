package io.github.drompincen.dispatchguard.persistence.document;

import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Document(collection = "workers")
public class WorkerDocument {

    @Id
    private String id;
    @Indexed(unique = true)
    private String workerNumber;
    private String fullName;
    private String fullNameKana;
    private String companyName;
    private String department;
    private String lineName;
    @Indexed
    private String worksiteId;
    private BigDecimal hourlyRate;
    private BigDecimal billingRate;
    @Indexed
    private WorkerStatus status;
    private String nationality;
    private String visaType;
    private LocalDate visaExpiryDate;
    private Instant createdAt;
    private Instant updatedAt;

    public WorkerDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWorkerNumber() { return workerNumber; }
    public void setWorkerNumber(String workerNumber) { this.workerNumber = workerNumber; }

    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName; }

    public String getFullNameKana() { return fullNameKana; }
    public void setFullNameKana(String fullNameKana) { this.fullNameKana = fullNameKana; }

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getDepartment() { return department; }
    public void setDepartment(String department) { this.department = department; }

    public String getLineName() { return lineName; }
    public void setLineName(String lineName) { this.lineName = lineName; }

    public String getWorksiteId() { return worksiteId; }
    public void setWorksiteId(String worksiteId) { this.worksiteId = worksiteId; }

    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }

    public BigDecimal getBillingRate() { return billingRate; }
    public void setBillingRate(BigDecimal billingRate) { this.billingRate = billingRate; }

    public WorkerStatus getStatus() { return status; }
    public void setStatus(WorkerStatus status) { this.status = status; }

    public String getNationality() { return nationality; }
    public void setNationality(String nationality) { this.nationality = nationality; }

    public String getVisaType() { return visaType; }
    public void setVisaType(String visaType) { this.visaType = visaType; }

    public LocalDate getVisaExpiryDate() { return visaExpiryDate; }
    public void setVisaExpiryDate(LocalDate visaExpiryDate) { this.visaExpiryDate = visaExpiryDate; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
