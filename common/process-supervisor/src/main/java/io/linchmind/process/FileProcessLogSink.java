package io.linchmind.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Appends each instance's output to {@code <dir>/<instanceId>.log}.
 */
public final class FileProcessLogSink implements ProcessLogSink {

  private final Path directory;

  public FileProcessLogSink(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public ProcessBuilder.Redirect redirectFor(String instanceId) throws IOException {
    Files.createDirectories(directory);
    return ProcessBuilder.Redirect.appendTo(logFile(instanceId).toFile());
  }

  public Path logFile(String instanceId) {
    return directory.resolve(instanceId + ".log");
  }
}
