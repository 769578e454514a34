package com.agentkernel.recovery;

import com.agentkernel.engine.logging.LoggingContext;
import com.agentkernel.engine.metrics.KernelMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs housekeeping jobs in their declared order. A job that throws is
 * logged and counted; the jobs after it still run.
 */
public class HousekeepingRunner {

    private static final Logger log = LoggerFactory.getLogger(HousekeepingRunner.class);

    private final List<HousekeepingJob> jobs;
    private final KernelMetrics metrics;

    public HousekeepingRunner(List<HousekeepingJob> jobs, KernelMetrics metrics) {
        this.jobs = List.copyOf(jobs);
        this.metrics = metrics;
    }

    /**
     * @return items acted on per job; jobs that failed are absent
     */
    public Map<String, Integer> runAll() {
        Map<String, Integer> results = new LinkedHashMap<>();
        for (HousekeepingJob job : jobs) {
            try (var ctx = LoggingContext.forJob(job.name())) {
                int handled = job.run();
                results.put(job.name(), handled);
                if (handled > 0) {
                    log.info("Housekeeping job {} handled {} item(s)", job.name(), handled);
                }
            } catch (RuntimeException e) {
                metrics.housekeepingFailed(job.name());
                log.error("Housekeeping job {} failed", job.name(), e);
            }
        }
        return results;
    }

    public List<HousekeepingJob> jobs() {
        return jobs;
    }
}
