package com.ryuqq.provisioner.adapter.file.state;

import com.ryuqq.provisioner.core.error.StateStoreException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps between {@link State} and its JSON document.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
final class StateDocumentMapper {

    // Utility class - prevent instantiation
    private StateDocumentMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static StateDocument toDocument(State state) {
        Map<String, ResourceDocument> resources = new TreeMap<>();
        for (Map.Entry<Address, StateEntry> entry : state.resources().entrySet()) {
            StateEntry value = entry.getValue();
            List<String> dependencies = new ArrayList<>();
            for (Address dependency : value.dependencies()) {
                dependencies.add(dependency.getValue());
            }
            resources.put(entry.getKey().getValue(), new ResourceDocument(
                value.attributes(), dependencies, value.priority(), value.createdAt(), value.updatedAt()));
        }
        return new StateDocument(StateDocument.CURRENT_VERSION, state.lineage(), state.serial(), state.targetKey(),
            state.digest(), resources);
    }

    static State toState(StateDocument document, Object source) {
        if (document == null) {
            throw new StateStoreException("State file is empty: " + source);
        }
        if (document.version() != StateDocument.CURRENT_VERSION) {
            throw new StateStoreException("Unsupported state file version " + document.version() + ": " + source);
        }
        try {
            Map<Address, StateEntry> entries = new TreeMap<>();
            if (document.resources() != null) {
                for (Map.Entry<String, ResourceDocument> entry : document.resources().entrySet()) {
                    ResourceDocument value = entry.getValue();
                    if (value == null) {
                        throw new StateStoreException("State entry is empty for " + entry.getKey() + ": " + source);
                    }
                    Set<Address> dependencies = new LinkedHashSet<>();
                    if (value.dependencies() != null) {
                        for (String dependency : value.dependencies()) {
                            dependencies.add(Address.parse(dependency));
                        }
                    }
                    entries.put(Address.parse(entry.getKey()), new StateEntry(
                        value.attributes(), dependencies, value.priority(), value.createdAt(), value.updatedAt()));
                }
            }
            return new State(document.lineage(), document.serial(), document.targetKey(), entries);
        } catch (IllegalArgumentException e) {
            throw new StateStoreException("State file is corrupt (" + e.getMessage() + "): " + source, e);
        }
    }
}
