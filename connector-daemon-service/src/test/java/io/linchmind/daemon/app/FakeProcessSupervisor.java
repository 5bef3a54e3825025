package io.linchmind.daemon.app;

import io.linchmind.process.ProcessSupervisor;
import io.linchmind.process.ResourceUsage;
import io.linchmind.process.SpawnFailedException;
import io.linchmind.process.SpawnRequest;
import io.linchmind.process.SupervisedProcess;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory process table. Processes live until stopped or {@link #crash(String) crashed}.
 */
class FakeProcessSupervisor implements ProcessSupervisor {

    private final AtomicLong nextPid = new AtomicLong(40_000);
    private final Map<Long, FakeProcess> processes = new ConcurrentHashMap<>();
    private final Map<String, SupervisedProcess> retained = new ConcurrentHashMap<>();
    final List<SpawnRequest> spawned = new CopyOnWriteArrayList<>();
    final AtomicInteger gracefulStops = new AtomicInteger();
    final AtomicInteger forcedStops = new AtomicInteger();
    volatile boolean failSpawns;
    volatile boolean ignoreTermination;
    volatile boolean unkillable;
    volatile Duration stopLatency = Duration.ZERO;

    @Override
    public SupervisedProcess start(SpawnRequest request) throws SpawnFailedException {
        if (failSpawns) {
            throw new SpawnFailedException(request.instanceId(), "failed to start " + request.executable()
                + ": No such file or directory", null);
        }
        spawned.add(request);
        long pid = nextPid.incrementAndGet();
        SupervisedProcess process = new SupervisedProcess(request.instanceId(), pid, request.executable(), Instant.now());
        processes.put(pid, new FakeProcess(ignoreTermination, unkillable));
        retained.put(request.instanceId(), process);
        return process;
    }

    @Override
    public boolean stop(SupervisedProcess process, boolean graceful, Duration timeout) {
        sleep(stopLatency);
        FakeProcess fake = processes.get(process.pid());
        if (fake == null || !fake.alive) {
            retained.remove(process.instanceId(), process);
            return true;
        }
        if (graceful) {
            gracefulStops.incrementAndGet();
            if (!fake.ignoresTermination) {
                fake.alive = false;
            }
        }
        if (fake.alive) {
            forcedStops.incrementAndGet();
            if (!fake.unkillable) {
                fake.alive = false;
            }
        }
        if (!fake.alive) {
            retained.remove(process.instanceId());
        }
        return !fake.alive;
    }

    @Override
    public boolean isAlive(long pid) {
        FakeProcess fake = processes.get(pid);
        return fake != null && fake.alive;
    }

    @Override
    public Optional<ResourceUsage> resourceUsage(long pid) {
        if (!isAlive(pid)) {
            return Optional.empty();
        }
        return Optional.of(new ResourceUsage(Duration.ofMillis(120), 8L * 1024 * 1024, null, Instant.now()));
    }

    @Override
    public Optional<SupervisedProcess> adopt(String instanceId, long pid, String expectedExecutable) {
        if (!isAlive(pid)) {
            return Optional.empty();
        }
        SupervisedProcess process = new SupervisedProcess(instanceId, pid, expectedExecutable, Instant.now());
        retained.put(instanceId, process);
        return Optional.of(process);
    }

    @Override
    public Optional<SupervisedProcess> retained(String instanceId) {
        SupervisedProcess process = retained.get(instanceId);
        if (process == null || !isAlive(process.pid())) {
            return Optional.empty();
        }
        return Optional.of(process);
    }

    /**
     * Simulates an external process that a later daemon run may adopt.
     */
    long launchOrphan() {
        long pid = nextPid.incrementAndGet();
        processes.put(pid, new FakeProcess(false, false));
        return pid;
    }

    void crash(String instanceId) {
        SupervisedProcess process = retained.get(instanceId);
        if (process != null) {
            processes.get(process.pid()).alive = false;
        }
    }

    long liveProcesses() {
        return processes.values().stream().filter(p -> p.alive).count();
    }

    private static void sleep(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class FakeProcess {
        private final boolean ignoresTermination;
        private final boolean unkillable;
        private volatile boolean alive = true;

        private FakeProcess(boolean ignoresTermination, boolean unkillable) {
            this.ignoresTermination = ignoresTermination;
            this.unkillable = unkillable;
        }
    }
}
