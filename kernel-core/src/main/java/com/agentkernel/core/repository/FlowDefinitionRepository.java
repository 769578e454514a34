package com.agentkernel.core.repository;

import com.agentkernel.core.model.FlowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for flow definitions. Lookups always take the cluster: two
 * clusters may define flows with the same name and different states.
 */
public interface FlowDefinitionRepository {

    /**
     * Register a flow definition, replacing any with the same name and cluster.
     *
     * @param definition The validated definition
     */
    void save(FlowDefinition definition);

    /**
     * Find a flow by name within a cluster.
     *
     * @param name    Flow name
     * @param cluster Cluster the flow belongs to
     * @return The definition if registered for that cluster
     */
    Optional<FlowDefinition> find(String name, String cluster);

    /**
     * List all registered definitions.
     */
    List<FlowDefinition> findAll();
}
