/* (C)2026 */
package com.ammann.coursecorrect.scheduled;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.coursecorrect.enumeration.JobStatus;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.VenueCorrection;
import com.ammann.coursecorrect.service.CorrectionTableRegistry;
import com.ammann.coursecorrect.support.TestDataFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class CorrectionRunMaintenanceServiceTest {

    @Inject CorrectionRunMaintenanceService service;

    @Inject CorrectionTableRegistry registry;

    @BeforeEach
    void setUp() {
        TestDataFactory.clearDatabase();
    }

    @Test
    void cleanupDeletesExpiredRunsButKeepsLatestCompleted() {
        Instant now = Instant.now();
        Long oldCompleted = TestDataFactory.storeRun(JobStatus.COMPLETED, now.minus(Duration.ofDays(20)));
        Long oldFailed = TestDataFactory.storeRun(JobStatus.FAILED, now.minus(Duration.ofDays(10)));
        Long latestCompleted = TestDataFactory.storeRun(JobStatus.COMPLETED, now.minus(Duration.ofDays(9)));
        Long recentFailed = TestDataFactory.storeRun(JobStatus.FAILED, now.minus(Duration.ofHours(1)));
        Long staleRunning = TestDataFactory.storeRun(JobStatus.RUNNING, now.minus(Duration.ofDays(30)));

        service.cleanupOldRuns();

        assertThat(CorrectionRun.<CorrectionRun>findById(oldCompleted)).isNull();
        assertThat(CorrectionRun.<CorrectionRun>findById(oldFailed)).isNull();
        assertThat(VenueCorrection.findByRunId(oldCompleted)).isEmpty();

        assertThat(CorrectionRun.<CorrectionRun>findById(latestCompleted)).isNotNull();
        assertThat(VenueCorrection.findByRunId(latestCompleted)).hasSize(7);
        assertThat(CorrectionRun.<CorrectionRun>findById(recentFailed)).isNotNull();
        assertThat(CorrectionRun.<CorrectionRun>findById(staleRunning)).isNotNull();
    }

    @Test
    void cleanupKeepsPublishedRun() {
        Instant now = Instant.now();
        Long published = TestDataFactory.storeRun(JobStatus.COMPLETED, now.minus(Duration.ofDays(20)));
        TestDataFactory.storeRun(JobStatus.COMPLETED, now.minus(Duration.ofDays(15)));
        registry.publish(TestDataFactory.referenceTable(published));

        service.cleanupOldRuns();

        assertThat(CorrectionRun.<CorrectionRun>findById(published)).isNotNull();
        assertThat(CorrectionRun.count()).isEqualTo(2);
    }

    @Test
    void cleanupWithNothingExpiredKeepsEverything() {
        TestDataFactory.storeRun(JobStatus.COMPLETED, Instant.now());
        TestDataFactory.storeRun(JobStatus.FAILED, Instant.now());

        service.cleanupOldRuns();

        assertThat(CorrectionRun.count()).isEqualTo(2);
    }
}
