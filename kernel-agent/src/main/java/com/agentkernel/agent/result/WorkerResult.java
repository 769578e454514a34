package com.agentkernel.agent.result;

import java.util.Objects;

/**
 * What a finished worker produced, normalised from whichever signal was
 * available.
 *
 * @param outcome  work outcome; for reviewers FAILURE means the review itself failed
 * @param decision review decision, null for work results and failed reviews
 * @param summary  free-text reason or review comment, may be null
 * @param source   the signal the outcome was read from
 * @param exitCode recorded exit code, null when none was written
 */
public record WorkerResult(
    WorkerOutcome outcome,
    ReviewDecision decision,
    String summary,
    ResultSource source,
    Integer exitCode
) {
    public WorkerResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(source, "source");
    }

    public static WorkerResult success(String summary, ResultSource source) {
        return new WorkerResult(WorkerOutcome.SUCCESS, null, summary, source, null);
    }

    public static WorkerResult failure(String summary, ResultSource source) {
        return new WorkerResult(WorkerOutcome.FAILURE, null, summary, source, null);
    }

    public static WorkerResult review(ReviewDecision decision, String comment) {
        return new WorkerResult(WorkerOutcome.SUCCESS, decision, comment, ResultSource.RESULT_ARTIFACT, null);
    }

    public WorkerResult withExitCode(Integer code) {
        return new WorkerResult(outcome, decision, summary, source, code);
    }

    public boolean isSuccess() {
        return outcome == WorkerOutcome.SUCCESS;
    }

    public String metricOutcome() {
        if (decision != null) {
            return decision.name().toLowerCase();
        }
        return outcome.name().toLowerCase();
    }
}
