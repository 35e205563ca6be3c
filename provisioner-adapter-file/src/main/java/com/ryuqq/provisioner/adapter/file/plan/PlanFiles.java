package com.ryuqq.provisioner.adapter.file.plan;

import com.fasterxml.jackson.core.JacksonException;
import com.ryuqq.provisioner.adapter.file.json.JsonMappers;
import com.ryuqq.provisioner.core.error.PlanFileException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.FieldDiff;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.plan.PlanMetadata;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Saves and loads plan artifacts as JSON.
 *
 * <p>A saved plan carries the lineage, serial and digest of the state it was computed
 * against, so applying it later is rejected as stale if the state moved on.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PlanFiles.save(provisioner.plan(provider, options), Path.of("tfplan.json"));
 * // ... review ...
 * provisioner.apply(PlanFiles.load(Path.of("tfplan.json")));
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PlanFiles {

    private static final Logger log = LoggerFactory.getLogger(PlanFiles.class);

    // Utility class - prevent instantiation
    private PlanFiles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Writes the plan to a file, replacing any existing file.
     *
     * @param plan the plan
     * @param path target file
     * @throws PlanFileException if the file cannot be written
     */
    public static void save(Plan plan, Path path) {
        if (plan == null || path == null) {
            throw new IllegalArgumentException("plan and path cannot be null");
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            JsonMappers.mapper().writeValue(path.toFile(), toDocument(plan));
        } catch (IOException e) {
            throw new PlanFileException("Failed to write plan file: " + path, e);
        }
        log.info("Saved plan with {} changes to {}", plan.changes().size(), path);
    }

    /**
     * Reads a plan from a file.
     *
     * @param path source file
     * @return the plan
     * @throws PlanFileException if the file is missing, unreadable or invalid
     */
    public static Plan load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.exists(path)) {
            throw new PlanFileException("Plan file not found: " + path);
        }
        PlanDocument document;
        try {
            document = JsonMappers.mapper().readValue(path.toFile(), PlanDocument.class);
        } catch (JacksonException e) {
            throw new PlanFileException("Plan file is not valid JSON: " + path, e);
        } catch (IOException e) {
            throw new PlanFileException("Failed to read plan file: " + path, e);
        }
        if (document == null || document.metadata() == null) {
            throw new PlanFileException("Plan file has no metadata: " + path);
        }
        if (document.formatVersion() != PlanDocument.CURRENT_FORMAT_VERSION) {
            throw new PlanFileException("Unsupported plan format version " + document.formatVersion() + ": " + path);
        }
        try {
            return toPlan(document);
        } catch (IllegalArgumentException e) {
            throw new PlanFileException("Plan file is invalid (" + e.getMessage() + "): " + path, e);
        }
    }

    static PlanDocument toDocument(Plan plan) {
        PlanMetadata m = plan.metadata();
        PlanDocument.Metadata metadata = new PlanDocument.Metadata(m.targetKey(), m.createdAt(), m.destroy(),
            m.refresh(), m.stateLineage(), m.stateSerial(), m.stateDigest(), m.configDigest(), m.engineVersion());

        List<PlanDocument.Change> changes = new ArrayList<>(plan.changes().size());
        for (ResourceChange change : plan.changes()) {
            List<PlanDocument.Diff> diff = new ArrayList<>(change.diff().size());
            for (FieldDiff fieldDiff : change.diff()) {
                diff.add(new PlanDocument.Diff(fieldDiff.field(), fieldDiff.before(), fieldDiff.after()));
            }
            List<String> dependencies = new ArrayList<>();
            for (Address dependency : change.dependencies()) {
                dependencies.add(dependency.getValue());
            }
            changes.add(new PlanDocument.Change(change.address().getValue(), change.action().getValue(),
                change.before(), change.after(), diff, dependencies, change.priority()));
        }
        return new PlanDocument(PlanDocument.CURRENT_FORMAT_VERSION, metadata, changes);
    }

    static Plan toPlan(PlanDocument document) {
        PlanDocument.Metadata m = document.metadata();
        PlanMetadata metadata = new PlanMetadata(m.targetKey(), m.createdAt(), m.destroy(), m.refresh(),
            m.stateLineage(), m.stateSerial(), m.stateDigest(), m.configDigest(), m.engineVersion());

        List<ResourceChange> changes = new ArrayList<>();
        if (document.changes() != null) {
            for (PlanDocument.Change change : document.changes()) {
                List<FieldDiff> diff = new ArrayList<>();
                if (change.diff() != null) {
                    for (PlanDocument.Diff fieldDiff : change.diff()) {
                        diff.add(new FieldDiff(fieldDiff.field(), fieldDiff.before(), fieldDiff.after()));
                    }
                }
                Set<Address> dependencies = new LinkedHashSet<>();
                if (change.dependencies() != null) {
                    for (String dependency : change.dependencies()) {
                        dependencies.add(Address.parse(dependency));
                    }
                }
                changes.add(new ResourceChange(Address.parse(change.address()), Action.fromValue(change.action()),
                    change.before(), change.after(), diff, dependencies, change.priority()));
            }
        }
        return new Plan(metadata, changes);
    }
}
