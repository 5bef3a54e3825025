package io.linchmind.process;

import java.io.IOException;

/**
 * Destination for a connector's combined stdout and stderr.
 */
public interface ProcessLogSink {

  ProcessBuilder.Redirect redirectFor(String instanceId) throws IOException;

  static ProcessLogSink discarding() {
    return instanceId -> ProcessBuilder.Redirect.DISCARD;
  }
}
