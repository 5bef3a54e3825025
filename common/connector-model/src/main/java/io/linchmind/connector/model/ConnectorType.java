package io.linchmind.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, immutable description of a class of connector, produced from a {@link ConnectorManifest}.
 * <p>
 * {@code maxInstancesPerUser} of {@code 0} means unbounded.
 */
public record ConnectorType(
    String typeId,
    String name,
    String displayName,
    String description,
    String category,
    String version,
    String author,
    String license,
    boolean supportsMultipleInstances,
    int maxInstancesPerUser,
    boolean hotConfigReload,
    boolean healthCheck,
    ConnectorEntryPoint entryPoint,
    List<String> permissions,
    Map<String, Object> configSchema,
    Map<String, Object> defaultConfig,
    List<InstanceTemplate> instanceTemplates,
    @JsonIgnore Path directory) {

    public ConnectorType {
        typeId = requireNonBlank(typeId, "typeId");
        name = requireNonBlank(name, "name");
        version = requireNonBlank(version, "version");
        Objects.requireNonNull(entryPoint, "entryPoint");
        displayName = displayName == null || displayName.isBlank() ? name : displayName;
        category = category == null || category.isBlank() ? "other" : category;
        if (maxInstancesPerUser < 0) {
            throw new IllegalArgumentException("maxInstancesPerUser must not be negative");
        }
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        configSchema = Documents.copyOf(configSchema);
        defaultConfig = Documents.copyOf(defaultConfig);
        instanceTemplates = instanceTemplates == null ? List.of() : List.copyOf(instanceTemplates);
    }

    /**
     * Upper bound on live instances of this type; {@link Integer#MAX_VALUE} when unbounded.
     */
    public int instanceLimit() {
        if (!supportsMultipleInstances) {
            return 1;
        }
        return maxInstancesPerUser == 0 ? Integer.MAX_VALUE : maxInstancesPerUser;
    }

    public InstanceTemplate template(String templateId) {
        if (templateId == null) {
            return null;
        }
        for (InstanceTemplate template : instanceTemplates) {
            if (templateId.equals(template.id())) {
                return template;
            }
        }
        return null;
    }

    /**
     * Executable path resolved against the type directory when relative.
     */
    public String resolvedExecutable() {
        Path executable = Path.of(entryPoint.executable());
        if (executable.isAbsolute() || directory == null) {
            return executable.toString();
        }
        return directory.resolve(executable).normalize().toString();
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
