package io.linchmind.connector.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Binding of a {@code connector.json} type manifest. Unknown fields are ignored; validation
 * happens once in {@link #toConnectorType(Path)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectorManifest(
    @JsonProperty("id") @JsonAlias("type_id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("description") String description,
    @JsonProperty("category") String category,
    @JsonProperty("version") String version,
    @JsonProperty("author") String author,
    @JsonProperty("license") String license,
    @JsonProperty("capabilities") Capabilities capabilities,
    @JsonProperty("entry") Entry entry,
    @JsonProperty("permissions") List<String> permissions,
    @JsonProperty("config_schema") Map<String, Object> configSchema,
    @JsonProperty("default_config") Map<String, Object> defaultConfig,
    @JsonProperty("instance_templates") List<InstanceTemplate> instanceTemplates) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Capabilities(
        @JsonProperty("supports_multiple_instances") Boolean supportsMultipleInstances,
        @JsonProperty("max_instances_per_user") Integer maxInstancesPerUser,
        @JsonProperty("hot_config_reload") Boolean hotConfigReload,
        @JsonProperty("health_check") Boolean healthCheck) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("executable") String executable,
        @JsonProperty("args") List<String> args) {
    }

    /**
     * Validates the manifest and applies defaults.
     *
     * @param directory the type directory the manifest was read from
     * @throws IllegalArgumentException when a required field is missing or malformed
     */
    public ConnectorType toConnectorType(Path directory) {
        if (entry == null || entry.executable() == null || entry.executable().isBlank()) {
            throw new IllegalArgumentException("entry.executable must not be blank");
        }
        Capabilities caps = capabilities == null ? new Capabilities(null, null, null, null) : capabilities;
        boolean multiple = Boolean.TRUE.equals(caps.supportsMultipleInstances());
        int maxInstances;
        if (caps.maxInstancesPerUser() != null) {
            maxInstances = caps.maxInstancesPerUser();
        } else {
            maxInstances = multiple ? 0 : 1;
        }
        if (multiple && caps.maxInstancesPerUser() != null && maxInstances < 1) {
            throw new IllegalArgumentException("max_instances_per_user must be positive");
        }
        return new ConnectorType(
            id,
            name,
            displayName,
            description,
            category,
            version,
            author,
            license,
            multiple,
            multiple ? maxInstances : 1,
            caps.hotConfigReload() == null || caps.hotConfigReload(),
            caps.healthCheck() == null || caps.healthCheck(),
            new ConnectorEntryPoint(entry.executable(), entry.args()),
            permissions,
            configSchema,
            defaultConfig,
            instanceTemplates,
            directory);
    }
}
