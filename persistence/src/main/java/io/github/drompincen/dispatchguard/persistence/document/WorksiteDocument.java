package io.github.drompincen.dispatchguard.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/** Client worksite (plant or office) receiving dispatched workers. */
@Document(collection = "worksites")
public class WorksiteDocument {

    @Id
    private String id;
    @Indexed(unique = true)
    private String worksiteKey;
    private String companyName;
    private String plantName;
    private String companyAddress;
    private String plantAddress;
    private String clientResponsibleName;
    private String clientResponsibleDepartment;
    private String clientComplaintName;
    private String dispatchResponsibleName;
    private String dispatchComplaintName;
    private LocalDate cutoffDate;
    @Indexed
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;

    public WorksiteDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWorksiteKey() { return worksiteKey; }
    public void setWorksiteKey(String worksiteKey) { this.worksiteKey = worksiteKey; }

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getPlantName() { return plantName; }
    public void setPlantName(String plantName) { this.plantName = plantName; }

    public String getCompanyAddress() { return companyAddress; }
    public void setCompanyAddress(String companyAddress) { this.companyAddress = companyAddress; }

    public String getPlantAddress() { return plantAddress; }
    public void setPlantAddress(String plantAddress) { this.plantAddress = plantAddress; }

    public String getClientResponsibleName() { return clientResponsibleName; }
    public void setClientResponsibleName(String clientResponsibleName) { this.clientResponsibleName = clientResponsibleName; }

    public String getClientResponsibleDepartment() { return clientResponsibleDepartment; }
    public void setClientResponsibleDepartment(String clientResponsibleDepartment) { this.clientResponsibleDepartment = clientResponsibleDepartment; }

    public String getClientComplaintName() { return clientComplaintName; }
    public void setClientComplaintName(String clientComplaintName) { this.clientComplaintName = clientComplaintName; }

    public String getDispatchResponsibleName() { return dispatchResponsibleName; }
    public void setDispatchResponsibleName(String dispatchResponsibleName) { this.dispatchResponsibleName = dispatchResponsibleName; }

    public String getDispatchComplaintName() { return dispatchComplaintName; }
    public void setDispatchComplaintName(String dispatchComplaintName) { this.dispatchComplaintName = dispatchComplaintName; }

    public LocalDate getCutoffDate() { return cutoffDate; }
    public void setCutoffDate(LocalDate cutoffDate) { this.cutoffDate = cutoffDate; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /** Display name used in alerts and reports, e.g. "Kainan Corp Okayama Plant". */
    public String displayName() {
        if (plantName == null || plantName.isBlank()) {
            return companyName;
        }
        return companyName + " " + plantName;
    }
}
