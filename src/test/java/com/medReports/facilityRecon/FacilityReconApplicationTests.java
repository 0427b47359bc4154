package com.medReports.facilityRecon;

import com.medReports.facilityRecon.config.ReconciliationConfig;
import com.medReports.facilityRecon.reconcile.model.ReconciliationSettings;
import com.medReports.facilityRecon.reconcile.model.ReportingPeriod;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the application context loads and binds the reconciliation properties.
 */
@SpringBootTest(properties = {
        "recon.cpt-codes=20600, 97110",
        "recon.reporting-period=quarter",
        "recon.facilities.known=Medilodge of Wyoming,,Medilodge of Wyoming",
        "recon.pipeline.parallelism=0"
})
class FacilityReconApplicationTests {

    @Autowired
    private ReconciliationConfig reconciliationConfig;

    @Test
    void newSettings_shouldBindReconciliationProperties() {
        ReconciliationSettings settings = reconciliationConfig.newSettings();

        assertThat(settings.getReportedCptCodes()).containsExactly("20600", "97110");
        assertThat(settings.getReportingPeriod()).isEqualTo(ReportingPeriod.QUARTER);
        assertThat(settings.getKnownFacilities()).containsExactly("Medilodge of Wyoming");
        assertThat(settings.getParallelism()).isEqualTo(1);
        assertThat(settings.getLastNamePrefixLength()).isEqualTo(3);
        assertThat(settings.getLongTermCarePosCode()).isEqualTo("32");
    }

    @Test
    void newSettings_shouldReturnAFreshValuePerRun() {
        assertThat(reconciliationConfig.newSettings()).isNotSameAs(reconciliationConfig.newSettings());
    }
}
