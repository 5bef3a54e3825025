package io.linchmind.daemon.app;

import io.linchmind.connector.model.ConnectorType;
import io.linchmind.daemon.domain.ConnectorLifecycleException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Presence checks only: the config must be an object and carry the schema's top-level
 * {@code required} keys. Everything else in the schema is opaque here.
 */
final class ConfigValidator {

    private ConfigValidator() {
    }

    static void validate(ConnectorType type, Map<String, Object> config) {
        if (config == null) {
            throw ConnectorLifecycleException.configInvalid("config must be a JSON object");
        }
        if (type == null) {
            return;
        }
        Object required = type.configSchema().get("required");
        if (!(required instanceof Collection<?> keys)) {
            return;
        }
        List<String> missing = new ArrayList<>();
        for (Object key : keys) {
            if (key instanceof String name && !config.containsKey(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw ConnectorLifecycleException.configInvalid(
                "config for type " + type.typeId() + " is missing required keys " + missing);
        }
    }
}
