package com.ryuqq.provisioner.testkit.remote;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.ReferenceExtractor;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistration;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resource types used across engine tests, modeled on a data-platform project.
 *
 * <table>
 *   <caption>Registered types</caption>
 *   <tr><th>type</th><th>priority</th><th>implicit references</th></tr>
 *   <tr><td>dss_variables</td><td>0</td><td>-</td></tr>
 *   <tr><td>dss_zone</td><td>100</td><td>-</td></tr>
 *   <tr><td>dss_dataset</td><td>100</td><td>{@code zone} (zone name)</td></tr>
 *   <tr><td>dss_python_recipe</td><td>100</td><td>{@code inputs}, {@code outputs} (dataset names), {@code zone}</td></tr>
 *   <tr><td>dss_scenario</td><td>200</td><td>-</td></tr>
 * </table>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class TestResourceTypes {

    public static final String VARIABLES = "dss_variables";
    public static final String ZONE = "dss_zone";
    public static final String DATASET = "dss_dataset";
    public static final String RECIPE = "dss_python_recipe";
    public static final String SCENARIO = "dss_scenario";

    // Utility class - prevent instantiation
    private TestResourceTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Registry with every test type backed by the given remote.
     *
     * @param remote fake remote
     * @return registry
     */
    public static ResourceTypeRegistry registry(InMemoryRemote remote) {
        InMemoryResourceHandler handler = new InMemoryResourceHandler(remote);
        ReferenceExtractor zoneRef = ReferenceExtractor.namesOf(ZONE, "zone");
        return new ResourceTypeRegistry()
            .register(new ResourceTypeRegistration(VARIABLES, 0, ReferenceExtractor.none(), handler))
            .register(ResourceTypeRegistration.of(ZONE, handler))
            .register(ResourceTypeRegistration.of(DATASET, handler).withReferences(zoneRef))
            .register(ResourceTypeRegistration.of(RECIPE, handler)
                .withReferences(ReferenceExtractor.namesOf(DATASET, "inputs", "outputs").and(zoneRef)))
            .register(new ResourceTypeRegistration(SCENARIO, 200, ReferenceExtractor.none(), handler));
    }

    public static Address datasetAddress(String name) {
        return Address.of(DATASET, name);
    }

    public static Address recipeAddress(String name) {
        return Address.of(RECIPE, name);
    }

    /**
     * Dataset with a connection and format.
     *
     * @param name dataset name
     * @return resource
     */
    public static Resource dataset(String name) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("connection", "filesystem_managed");
        attributes.put("format", "csv");
        return Resource.of(DATASET, name, attributes);
    }

    /**
     * Dataset with explicit attributes.
     *
     * @param name dataset name
     * @param attributes attributes
     * @return resource
     */
    public static Resource dataset(String name, Map<String, ?> attributes) {
        return Resource.of(DATASET, name, attributes);
    }

    /**
     * Python recipe reading and writing datasets by name.
     *
     * @param name recipe name
     * @param inputs input dataset names
     * @param outputs output dataset names
     * @return resource
     */
    public static Resource recipe(String name, List<String> inputs, List<String> outputs) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("inputs", inputs);
        attributes.put("outputs", outputs);
        attributes.put("code", "# " + name);
        return Resource.of(RECIPE, name, attributes);
    }

    /**
     * Project variables (priority 0).
     *
     * @param values variable values
     * @return resource
     */
    public static Resource variables(Map<String, ?> values) {
        return Resource.of(VARIABLES, "variables", Map.of("standard", values)).withPriority(0);
    }

    /**
     * Scenario (priority 200).
     *
     * @param name scenario name
     * @return resource
     */
    public static Resource scenario(String name) {
        return Resource.of(SCENARIO, name, Map.of("active", true)).withPriority(200);
    }
}
