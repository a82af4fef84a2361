package io.github.drompincen.dispatchguard.runtime.scheduler;

import io.github.drompincen.dispatchguard.protocol.api.AuditScope;
import io.github.drompincen.dispatchguard.runtime.alert.AlertSweeper;
import io.github.drompincen.dispatchguard.runtime.compliance.ComplianceAuditor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ComplianceSchedulerTest {

    @Mock
    private AlertSweeper alertSweeper;
    @Mock
    private ComplianceAuditor complianceAuditor;

    private ComplianceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ComplianceScheduler(alertSweeper, complianceAuditor);
    }

    @Test
    void dailySweepFailureIsLoggedNotRethrown() {
        when(alertSweeper.dailyDigest()).thenThrow(new DataAccessResourceFailureException("store down"));

        assertThatCode(scheduler::dailySweep).doesNotThrowAnyException();
        verify(alertSweeper).dailyDigest();
    }

    @Test
    void weeklyAuditRunsFullScope() {
        when(complianceAuditor.audit(any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(scheduler::weeklyAudit).doesNotThrowAnyException();
        verify(complianceAuditor).audit(AuditScope.full());
    }
}
