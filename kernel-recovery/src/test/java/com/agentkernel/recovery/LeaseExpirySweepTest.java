package com.agentkernel.recovery;

import com.agentkernel.agent.process.Liveness;
import com.agentkernel.core.model.Task;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseExpirySweepTest {

    @TempDir
    Path runtimeDir;

    private RecoveryFixture kernel;
    private LeaseExpirySweep sweep;

    @BeforeEach
    void setUp() {
        kernel = new RecoveryFixture(runtimeDir);
        sweep = new LeaseExpirySweep(kernel.repository, kernel.tracker, kernel.metrics, kernel.time);
    }

    @Test
    @DisplayName("Live leases are left alone")
    void testUnexpiredLeaseUntouched() {
        kernel.claimedForWork("T-1");
        kernel.time.advanceMinutes(29);

        assertThat(sweep.run()).isZero();
        assertThat(kernel.tasks.get("T-1").queue()).isEqualTo("claimed");
    }

    @Test
    @DisplayName("An expired work claim is requeued with one more attempt")
    void testExpiredWorkClaimRequeued() {
        kernel.claimedForWork("T-1");
        kernel.time.advanceMinutes(31);

        assertThat(sweep.run()).isEqualTo(1);

        Task after = kernel.tasks.get("T-1");
        assertThat(after.queue()).isEqualTo("incoming");
        assertThat(after.isClaimed()).isFalse();
        assertThat(after.attemptCount()).isEqualTo(1);
        assertThat(after.lastError()).contains("lease of implementer expired");
        assertThat(kernel.metrics.count(KernelMetrics.LEASE_EXPIRATIONS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An expired review claim is released in place")
    void testExpiredReviewClaimReleased() {
        kernel.claimedForReview("T-1");
        kernel.time.advanceMinutes(31);

        sweep.run();

        Task after = kernel.tasks.get("T-1");
        assertThat(after.queue()).isEqualTo("provisional");
        assertThat(after.isClaimed()).isFalse();
        assertThat(after.attemptCount()).isZero();
    }

    @Test
    @DisplayName("A renewed lease survives the sweep")
    void testRenewedLeaseSurvives() {
        kernel.claimedForWork("T-1");
        kernel.time.advanceMinutes(20);
        kernel.claims.renew("T-1", "implementer", Duration.ofMinutes(30));
        kernel.time.advanceMinutes(20);

        assertThat(sweep.run()).isZero();
        assertThat(kernel.tasks.get("T-1").queue()).isEqualTo("claimed");
    }

    @Test
    @DisplayName("A task whose worker finished waits for its result instead of expiring")
    void testPendingResultSkipped() {
        Task task = kernel.claimedForWork("T-1");
        kernel.track(task, 77, Liveness.DEAD);
        kernel.registry.markFinished(kernel.registry.findByTask("T-1").orElseThrow().instanceId());
        kernel.time.advanceMinutes(31);

        assertThat(sweep.run()).isZero();
        assertThat(kernel.tasks.get("T-1").queue()).isEqualTo("claimed");
    }
}
