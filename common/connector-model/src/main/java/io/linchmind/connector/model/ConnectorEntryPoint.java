package io.linchmind.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectorEntryPoint(@NotBlank String executable, List<String> args) {
    public ConnectorEntryPoint {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public ConnectorEntryPoint(String executable) {
        this(executable, null);
    }
}
