package com.agentkernel.recovery;

import com.agentkernel.core.test.FailureInjector;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HousekeepingRunnerTest {

    @Test
    void testFailingJobDoesNotStopTheOthers() {
        KernelMetrics metrics = new KernelMetrics();
        List<String> ran = new ArrayList<>();
        FailureInjector injector = FailureInjector.builder()
            .failFirst(1)
            .withFailure(() -> new IllegalStateException("store unavailable"))
            .build();

        HousekeepingRunner runner = new HousekeepingRunner(List.of(
            HousekeepingJob.of("first", () -> ran.add("first")),
            HousekeepingJob.of("flaky", injector::hit),
            HousekeepingJob.of("last", () -> ran.add("last"))
        ), metrics);

        Map<String, Integer> results = runner.runAll();

        assertThat(ran).containsExactly("first", "last");
        assertThat(results).containsOnlyKeys("first", "last");
        assertThat(metrics.count(KernelMetrics.HOUSEKEEPING_FAILURES, "job", "flaky")).isEqualTo(1.0);

        assertThat(runner.runAll()).containsKey("flaky");
        assertThat(injector.getInvocationCount()).isEqualTo(2);
    }
}
