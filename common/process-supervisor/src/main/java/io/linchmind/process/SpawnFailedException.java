package io.linchmind.process;

/**
 * The OS could not create the connector process.
 */
public class SpawnFailedException extends Exception {

  private final String instanceId;

  public SpawnFailedException(String instanceId, String message, Throwable cause) {
    super(message, cause);
    this.instanceId = instanceId;
  }

  public String getInstanceId() {
    return instanceId;
  }
}
