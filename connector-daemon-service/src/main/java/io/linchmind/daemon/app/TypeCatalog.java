package io.linchmind.daemon.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorManifest;
import io.linchmind.connector.model.ConnectorType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector types found under the types root directory, one {@code <type-dir>/<manifest>} each.
 * <p>
 * Each discovery replaces the catalogue wholesale. A malformed manifest is logged and skipped.
 */
public class TypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(TypeCatalog.class);

    private final ObjectMapper mapper;
    private final Path rootDir;
    private final String manifestFile;
    private final AtomicReference<Map<String, ConnectorType>> types = new AtomicReference<>(Map.of());

    public TypeCatalog(ObjectMapper mapper, Path rootDir, String manifestFile) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
        this.manifestFile = Objects.requireNonNull(manifestFile, "manifestFile");
    }

    public List<ConnectorType> discover() {
        Map<String, ConnectorType> found = new LinkedHashMap<>();
        if (!Files.isDirectory(rootDir)) {
            log.warn("connector types directory {} does not exist", rootDir);
            types.set(Map.of());
            return List.of();
        }
        List<Path> dirs;
        try (Stream<Path> stream = Files.list(rootDir)) {
            dirs = stream.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.warn("cannot list connector types in {}: {}", rootDir, e.getMessage());
            return all();
        }
        for (Path dir : dirs) {
            Path manifest = dir.resolve(manifestFile);
            if (!Files.isRegularFile(manifest)) {
                log.debug("skipping {}: no {}", dir, manifestFile);
                continue;
            }
            try {
                ConnectorType type = mapper.readValue(manifest.toFile(), ConnectorManifest.class)
                    .toConnectorType(dir.toAbsolutePath().normalize());
                ConnectorType previous = found.putIfAbsent(type.typeId(), type);
                if (previous != null) {
                    log.warn("skipping {}: type {} already declared in {}", manifest, type.typeId(), previous.directory());
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("skipping malformed manifest {}: {}", manifest, e.getMessage());
            }
        }
        types.set(Collections.unmodifiableMap(found));
        log.info("discovered {} connector types in {}: {}", found.size(), rootDir, found.keySet());
        return List.copyOf(found.values());
    }

    public Optional<ConnectorType> get(String typeId) {
        if (typeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get().get(typeId));
    }

    public List<ConnectorType> all() {
        return new ArrayList<>(types.get().values());
    }
}
