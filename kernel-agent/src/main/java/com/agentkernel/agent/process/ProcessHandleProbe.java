package com.agentkernel.agent.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes local processes through {@link ProcessHandle}.
 */
public class ProcessHandleProbe implements ProcessProbe {

    private static final Logger log = LoggerFactory.getLogger(ProcessHandleProbe.class);

    @Override
    public Liveness probe(long pid) {
        try {
            return ProcessHandle.of(pid)
                .map(handle -> handle.isAlive() ? Liveness.ALIVE : Liveness.DEAD)
                .orElse(Liveness.DEAD);
        } catch (SecurityException | UnsupportedOperationException e) {
            log.warn("Cannot probe pid {}: {}", pid, e.getMessage());
            return Liveness.UNKNOWN;
        }
    }
}
