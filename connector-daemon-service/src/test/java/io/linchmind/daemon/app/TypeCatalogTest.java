package io.linchmind.daemon.app;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.linchmind.connector.model.ConnectorType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TypeCatalogTest {

    private final ObjectMapper mapper = new JacksonConfiguration().objectMapper();

    @TempDir
    Path root;

    @Test
    void discoversManifestsAndSkipsMalformedOnes() throws IOException {
        write("filesystem", """
            {"id": "filesystem", "name": "filesystem", "version": "1.0.0",
             "capabilities": {"supports_multiple_instances": true},
             "entry": {"executable": "bin/fs"}}
            """);
        write("clipboard", """
            {"id": "clipboard", "name": "clipboard", "version": "0.2.0", "entry": {"executable": "/usr/bin/clip"}}
            """);
        write("broken", "{\"id\": \"broken\", ");
        write("no-entry", "{\"id\": \"no-entry\", \"name\": \"x\", \"version\": \"1\"}");
        Files.createDirectories(root.resolve("empty"));

        TypeCatalog catalog = new TypeCatalog(mapper, root, "connector.json");
        List<ConnectorType> types = catalog.discover();

        assertThat(types).extracting(ConnectorType::typeId).containsExactly("clipboard", "filesystem");
        ConnectorType fs = catalog.get("filesystem").orElseThrow();
        assertThat(fs.resolvedExecutable()).isEqualTo(root.resolve("filesystem/bin/fs").toAbsolutePath().toString());
        assertThat(catalog.get("broken")).isEmpty();
    }

    @Test
    void rediscoveryReplacesTheCatalogue() throws IOException {
        write("filesystem", """
            {"id": "filesystem", "name": "filesystem", "version": "1.0.0", "entry": {"executable": "bin/fs"}}
            """);
        TypeCatalog catalog = new TypeCatalog(mapper, root, "connector.json");
        catalog.discover();

        Files.delete(root.resolve("filesystem/connector.json"));
        write("email", """
            {"id": "email", "name": "email", "version": "2.0.0", "entry": {"executable": "bin/mail"}}
            """);

        assertThat(catalog.discover()).extracting(ConnectorType::typeId).containsExactly("email");
        assertThat(catalog.get("filesystem")).isEmpty();
    }

    @Test
    void missingRootYieldsEmptyCatalogue() {
        TypeCatalog catalog = new TypeCatalog(mapper, root.resolve("absent"), "connector.json");

        assertThat(catalog.discover()).isEmpty();
        assertThat(catalog.all()).isEmpty();
    }

    private void write(String dir, String manifest) throws IOException {
        Path typeDir = Files.createDirectories(root.resolve(dir));
        Files.writeString(typeDir.resolve("connector.json"), manifest);
    }
}
