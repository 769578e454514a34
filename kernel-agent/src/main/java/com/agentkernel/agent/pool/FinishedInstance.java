package com.agentkernel.agent.pool;

import com.agentkernel.agent.result.WorkerResult;

public record FinishedInstance(InstanceRecord record, WorkerResult result) {
}
