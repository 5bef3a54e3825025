package io.linchmind.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record SpawnRequest(String instanceId,
                           String executable,
                           List<String> args,
                           Map<String, String> environment,
                           Path workingDirectory) {

  public SpawnRequest {
    instanceId = requireNonBlank(instanceId, "instanceId");
    executable = requireNonBlank(executable, "executable");
    args = args == null ? List.of() : List.copyOf(args);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  public List<String> command() {
    List<String> command = new ArrayList<>(args.size() + 1);
    command.add(executable);
    command.addAll(args);
    return List.copyOf(command);
  }

  private static String requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return Objects.requireNonNull(value);
  }
}
