package io.github.drompincen.dispatchguard.persistence.document;

import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Individual dispatch contract (個別契約書). Carries the 16 items required by
 * 労働者派遣法第26条 plus dispatch period, rates and status.
 */
@Document(collection = "contracts")
@CompoundIndex(name = "status_end", def = "{'status': 1, 'dispatchEndDate': 1}")
public class ContractDocument {

    @Id
    private String id;
    @Indexed(unique = true, sparse = true)
    private String contractNumber;
    @Indexed
    private String worksiteId;
    @Indexed
    private List<String> workerIds;

    private String workContent;
    private String responsibilityLevel;
    private String worksiteName;
    private String worksiteAddress;
    private String supervisorName;
    private String supervisorDepartment;
    private String supervisorPosition;
    private List<String> workDays;
    private LocalTime workStartTime;
    private LocalTime workEndTime;
    private Integer breakTimeMinutes;
    private String safetyMeasures;
    private ContactInfo dispatchComplaintContact;
    private ContactInfo clientComplaintContact;
    private String terminationMeasures;
    private ContactInfo dispatchManager;
    private ContactInfo clientManager;

    private BigDecimal hourlyRate;
    private BigDecimal overtimeRate;
    private BigDecimal overtimeMaxHoursDay;
    private BigDecimal overtimeMaxHoursMonth;
    private Integer numberOfWorkers;

    private LocalDate dispatchStartDate;
    private LocalDate dispatchEndDate;
    private ContractStatus status;
    private Instant createdAt;
    private Instant updatedAt;

    public ContractDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getContractNumber() { return contractNumber; }
    public void setContractNumber(String contractNumber) { this.contractNumber = contractNumber; }

    public String getWorksiteId() { return worksiteId; }
    public void setWorksiteId(String worksiteId) { this.worksiteId = worksiteId; }

    public List<String> getWorkerIds() { return workerIds; }
    public void setWorkerIds(List<String> workerIds) { this.workerIds = workerIds; }

    public String getWorkContent() { return workContent; }
    public void setWorkContent(String workContent) { this.workContent = workContent; }

    public String getResponsibilityLevel() { return responsibilityLevel; }
    public void setResponsibilityLevel(String responsibilityLevel) { this.responsibilityLevel = responsibilityLevel; }

    public String getWorksiteName() { return worksiteName; }
    public void setWorksiteName(String worksiteName) { this.worksiteName = worksiteName; }

    public String getWorksiteAddress() { return worksiteAddress; }
    public void setWorksiteAddress(String worksiteAddress) { this.worksiteAddress = worksiteAddress; }

    public String getSupervisorName() { return supervisorName; }
    public void setSupervisorName(String supervisorName) { this.supervisorName = supervisorName; }

    public String getSupervisorDepartment() { return supervisorDepartment; }
    public void setSupervisorDepartment(String supervisorDepartment) { this.supervisorDepartment = supervisorDepartment; }

    public String getSupervisorPosition() { return supervisorPosition; }
    public void setSupervisorPosition(String supervisorPosition) { this.supervisorPosition = supervisorPosition; }

    public List<String> getWorkDays() { return workDays; }
    public void setWorkDays(List<String> workDays) { this.workDays = workDays; }

    public LocalTime getWorkStartTime() { return workStartTime; }
    public void setWorkStartTime(LocalTime workStartTime) { this.workStartTime = workStartTime; }

    public LocalTime getWorkEndTime() { return workEndTime; }
    public void setWorkEndTime(LocalTime workEndTime) { this.workEndTime = workEndTime; }

    public Integer getBreakTimeMinutes() { return breakTimeMinutes; }
    public void setBreakTimeMinutes(Integer breakTimeMinutes) { this.breakTimeMinutes = breakTimeMinutes; }

    public String getSafetyMeasures() { return safetyMeasures; }
    public void setSafetyMeasures(String safetyMeasures) { this.safetyMeasures = safetyMeasures; }

    public ContactInfo getDispatchComplaintContact() { return dispatchComplaintContact; }
    public void setDispatchComplaintContact(ContactInfo dispatchComplaintContact) { this.dispatchComplaintContact = dispatchComplaintContact; }

    public ContactInfo getClientComplaintContact() { return clientComplaintContact; }
    public void setClientComplaintContact(ContactInfo clientComplaintContact) { this.clientComplaintContact = clientComplaintContact; }

    public String getTerminationMeasures() { return terminationMeasures; }
    public void setTerminationMeasures(String terminationMeasures) { this.terminationMeasures = terminationMeasures; }

    public ContactInfo getDispatchManager() { return dispatchManager; }
    public void setDispatchManager(ContactInfo dispatchManager) { this.dispatchManager = dispatchManager; }

    public ContactInfo getClientManager() { return clientManager; }
    public void setClientManager(ContactInfo clientManager) { this.clientManager = clientManager; }

    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }

    public BigDecimal getOvertimeRate() { return overtimeRate; }
    public void setOvertimeRate(BigDecimal overtimeRate) { this.overtimeRate = overtimeRate; }

    public BigDecimal getOvertimeMaxHoursDay() { return overtimeMaxHoursDay; }
    public void setOvertimeMaxHoursDay(BigDecimal overtimeMaxHoursDay) { this.overtimeMaxHoursDay = overtimeMaxHoursDay; }

    public BigDecimal getOvertimeMaxHoursMonth() { return overtimeMaxHoursMonth; }
    public void setOvertimeMaxHoursMonth(BigDecimal overtimeMaxHoursMonth) { this.overtimeMaxHoursMonth = overtimeMaxHoursMonth; }

    public Integer getNumberOfWorkers() { return numberOfWorkers; }
    public void setNumberOfWorkers(Integer numberOfWorkers) { this.numberOfWorkers = numberOfWorkers; }

    public LocalDate getDispatchStartDate() { return dispatchStartDate; }
    public void setDispatchStartDate(LocalDate dispatchStartDate) { this.dispatchStartDate = dispatchStartDate; }

    public LocalDate getDispatchEndDate() { return dispatchEndDate; }
    public void setDispatchEndDate(LocalDate dispatchEndDate) { this.dispatchEndDate = dispatchEndDate; }

    public ContractStatus getStatus() { return status; }
    public void setStatus(ContractStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
