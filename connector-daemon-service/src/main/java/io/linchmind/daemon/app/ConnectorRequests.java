package io.linchmind.daemon.app;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * Request bodies of the connector API. Snake-case aliases are accepted for connector clients.
 */
final class ConnectorRequests {

    private ConnectorRequests() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CreateInstance(@NotBlank @JsonAlias("type_id") String typeId,
                          @JsonAlias("display_name") String displayName,
                          Map<String, Object> config,
                          @JsonAlias("auto_start") Boolean autoStart,
                          @JsonAlias("template_id") String templateId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Batch(@NotNull @JsonAlias("instance_ids") List<String> instanceIds, Boolean force) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Heartbeat(Long ingested) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigAck(@NotNull @JsonAlias("config_version") Long configVersion) {
    }
}
