package io.linchmind.daemon.domain;

public record DeleteResult(String instanceId, boolean wasRunning) {
}
