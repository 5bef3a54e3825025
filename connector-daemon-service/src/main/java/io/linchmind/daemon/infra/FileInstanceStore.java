package io.linchmind.daemon.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorInstance;
import io.linchmind.connector.model.ConnectorState;
import io.linchmind.daemon.domain.InstanceStore;
import io.linchmind.daemon.domain.InstanceUpdate;
import io.linchmind.daemon.domain.StoreUnavailableException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InstanceStore} keeping one JSON document per instance under a directory.
 * <p>
 * Records are cached in memory and written through; each write goes to a temporary file that is
 * then moved over the record, so a crash never leaves a torn document behind.
 */
public class FileInstanceStore implements InstanceStore {

    private static final Logger log = LoggerFactory.getLogger(FileInstanceStore.class);
    private static final String SUFFIX = ".json";

    private final ObjectMapper mapper;
    private final Path directory;
    private final Clock clock;
    private final Map<String, ConnectorInstance> cache = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public FileInstanceStore(ObjectMapper mapper, Path directory, Clock clock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        load();
    }

    private void load() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot create instance store directory " + directory, e);
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).toList()) {
                try {
                    ConnectorInstance instance = mapper.readValue(file.toFile(), ConnectorInstance.class);
                    cache.put(instance.instanceId(), instance);
                } catch (IOException | IllegalArgumentException | NullPointerException e) {
                    log.warn("skipping unreadable instance record {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot read instance store directory " + directory, e);
        }
        log.info("instance store loaded {} instances from {}", cache.size(), directory);
    }

    @Override
    public String create(ConnectorInstance instance) {
        Objects.requireNonNull(instance, "instance");
        lock.writeLock().lock();
        try {
            if (cache.containsKey(instance.instanceId())) {
                throw new IllegalArgumentException("instance " + instance.instanceId() + " already exists");
            }
            write(instance);
            cache.put(instance.instanceId(), instance);
            return instance.instanceId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ConnectorInstance> get(String instanceId) {
        return Optional.ofNullable(cache.get(instanceId));
    }

    @Override
    public boolean update(String instanceId, InstanceUpdate update) {
        lock.writeLock().lock();
        try {
            ConnectorInstance current = cache.get(instanceId);
            if (current == null || !update.matches(current.state())) {
                return false;
            }
            ConnectorInstance updated = update.applyTo(current, clock.instant());
            write(updated);
            cache.put(instanceId, updated);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String instanceId) {
        lock.writeLock().lock();
        try {
            if (cache.remove(instanceId) == null) {
                return false;
            }
            Files.deleteIfExists(fileFor(instanceId));
            return true;
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot delete record of instance " + instanceId, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ConnectorInstance> list(String typeId, ConnectorState state) {
        List<ConnectorInstance> result = new ArrayList<>();
        for (ConnectorInstance instance : cache.values()) {
            if ((typeId == null || typeId.equals(instance.typeId())) && (state == null || state == instance.state())) {
                result.add(instance);
            }
        }
        result.sort(Comparator.comparing(ConnectorInstance::createdAt).thenComparing(ConnectorInstance::instanceId));
        return result;
    }

    private void write(ConnectorInstance instance) {
        Path target = fileFor(instance.instanceId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), instance);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot write record of instance " + instance.instanceId(), e);
        }
    }

    private Path fileFor(String instanceId) {
        Path file = directory.resolve(instanceId + SUFFIX).normalize();
        if (!file.getParent().equals(directory)) {
            throw new IllegalArgumentException("invalid instance id " + instanceId);
        }
        return file;
    }
}
