package dk.lawoffice.intranet.frontend.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileTokenStoreTest {

    @TempDir
    Path directory;

    @Test
    void savedTokensSurviveANewStore() {
        Path file = directory.resolve("nested").resolve("tokens.json");
        new FileTokenStore(file, ApiClientFactory.createObjectMapper()).save(new StoredTokens("access", "refresh"));

        FileTokenStore reopened = new FileTokenStore(file, ApiClientFactory.createObjectMapper());

        assertEquals(new StoredTokens("access", "refresh"), reopened.load().orElseThrow());
        assertEquals("access", reopened.accessToken().orElseThrow());
    }

    @Test
    void tokenFileIsOwnerOnlyAndReplacedWhole() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path file = directory.resolve("tokens.json");
        Files.writeString(file, "stale");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));
        FileTokenStore store = new FileTokenStore(file, ApiClientFactory.createObjectMapper());

        store.save(new StoredTokens("access", "refresh"));

        assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
        assertEquals(new StoredTokens("access", "refresh"), store.load().orElseThrow());
        try (Stream<Path> files = Files.list(directory)) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
    }

    @Test
    void clearRemovesTheFile() {
        Path file = directory.resolve("tokens.json");
        FileTokenStore store = new FileTokenStore(file, ApiClientFactory.createObjectMapper());
        store.save(new StoredTokens("access", "refresh"));

        store.clear();

        assertFalse(Files.exists(file));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void unreadableFileIsIgnored() throws Exception {
        Path file = directory.resolve("tokens.json");
        Files.writeString(file, "not json");

        assertTrue(new FileTokenStore(file, ApiClientFactory.createObjectMapper()).load().isEmpty());
    }
}
