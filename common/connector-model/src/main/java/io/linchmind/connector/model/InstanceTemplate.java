package io.linchmind.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Named preset configuration declared by a connector type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstanceTemplate(String id, String name, String description, Map<String, Object> config) {
    public InstanceTemplate {
        config = Documents.copyOf(config);
    }
}
