package io.github.drompincen.dispatchguard.runtime.support;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorksiteDocument;
import io.github.drompincen.dispatchguard.persistence.document.WorkerDocument;
import io.github.drompincen.dispatchguard.protocol.api.ContactInfo;
import io.github.drompincen.dispatchguard.protocol.api.ContractStatus;
import io.github.drompincen.dispatchguard.protocol.api.WorkerStatus;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/** Builders for fully-populated documents shared by the runtime tests. */
public final class Fixtures {

    public static final ZoneId ZONE = ZoneId.of("Asia/Tokyo");
    public static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private Fixtures() {}

    public static Clock clock() {
        return Clock.fixed(TODAY.atTime(9, 0).atZone(ZONE).toInstant(), ZONE);
    }

    public static ContractDocument validContract(String id) {
        ContractDocument c = new ContractDocument();
        c.setId(id);
        c.setContractNumber("KOB-202404-" + id);
        c.setWorksiteId("ws1");
        c.setWorkerIds(List.of());
        c.setWorkContent("Assembly line parts inspection");
        c.setResponsibilityLevel("General");
        c.setWorksiteName("Kainan Okayama Plant");
        c.setWorksiteAddress("1-2-3 Minami-ku, Okayama");
        c.setSupervisorName("Tanaka Ichiro");
        c.setSupervisorDepartment("Production");
        c.setSupervisorPosition("Manager");
        c.setWorkDays(List.of("MON", "TUE", "WED", "THU", "FRI"));
        c.setWorkStartTime(LocalTime.of(8, 0));
        c.setWorkEndTime(LocalTime.of(17, 0));
        c.setBreakTimeMinutes(60);
        c.setSafetyMeasures("Safety training before start");
        c.setTerminationMeasures("30 days notice and reassignment support");
        c.setDispatchComplaintContact(new ContactInfo("Sato Hanako", "HR", "Lead", "086-000-0001"));
        c.setClientComplaintContact(new ContactInfo("Suzuki Jiro", "General Affairs", null, null));
        c.setDispatchManager(new ContactInfo("Kobayashi Ken", "Dispatch Office", "Manager", null));
        c.setClientManager(new ContactInfo("Yamamoto Aki", "Production", "Director", null));
        c.setHourlyRate(new BigDecimal("1500"));
        c.setOvertimeRate(new BigDecimal("1875"));
        c.setOvertimeMaxHoursDay(new BigDecimal("3"));
        c.setOvertimeMaxHoursMonth(new BigDecimal("40"));
        c.setNumberOfWorkers(1);
        c.setDispatchStartDate(LocalDate.of(2024, 4, 1));
        c.setDispatchEndDate(LocalDate.of(2025, 3, 31));
        c.setStatus(ContractStatus.ACTIVE);
        return c;
    }

    public static WorksiteDocument completeWorksite(String id) {
        WorksiteDocument w = new WorksiteDocument();
        w.setId(id);
        w.setWorksiteKey("kainan_okayama_" + id);
        w.setCompanyName("Kainan Corp");
        w.setPlantName("Okayama Plant");
        w.setCompanyAddress("1-1 Kita-ku, Okayama");
        w.setPlantAddress("1-2-3 Minami-ku, Okayama");
        w.setClientResponsibleName("Yamamoto Aki");
        w.setClientResponsibleDepartment("Production");
        w.setClientComplaintName("Suzuki Jiro");
        w.setDispatchResponsibleName("Kobayashi Ken");
        w.setDispatchComplaintName("Sato Hanako");
        w.setCutoffDate(LocalDate.of(2026, 10, 1));
        w.setActive(true);
        return w;
    }

    public static WorkerDocument worker(String id, WorkerStatus status) {
        WorkerDocument w = new WorkerDocument();
        w.setId(id);
        w.setWorkerNumber("E" + id);
        w.setFullName("Worker " + id);
        w.setCompanyName("Kainan Corp");
        w.setStatus(status);
        w.setNationality("Japan");
        return w;
    }
}
