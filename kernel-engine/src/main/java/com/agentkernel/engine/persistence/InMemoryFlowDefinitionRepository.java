package com.agentkernel.engine.persistence;

import com.agentkernel.core.model.FlowDefinition;
import com.agentkernel.core.repository.FlowDefinitionRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of flow definitions, keyed by (name, cluster).
 * Flows come from configuration at startup, so there is no durable store.
 */
@Repository
public class InMemoryFlowDefinitionRepository implements FlowDefinitionRepository {

    private final Map<String, FlowDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public void save(FlowDefinition definition) {
        definitions.put(definition.validated().key(), definition);
    }

    @Override
    public Optional<FlowDefinition> find(String name, String cluster) {
        return Optional.ofNullable(definitions.get(FlowDefinition.key(name, cluster)));
    }

    @Override
    public List<FlowDefinition> findAll() {
        List<FlowDefinition> all = new ArrayList<>(definitions.values());
        all.sort(Comparator.comparing(FlowDefinition::key));
        return all;
    }
}
