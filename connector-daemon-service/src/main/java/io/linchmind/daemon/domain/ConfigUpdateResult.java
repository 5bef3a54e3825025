package io.linchmind.daemon.domain;

public record ConfigUpdateResult(boolean hotReloadApplied, boolean requiresRestart) {
}
