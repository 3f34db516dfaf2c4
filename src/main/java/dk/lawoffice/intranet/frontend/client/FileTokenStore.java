package dk.lawoffice.intranet.frontend.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the tokens in a JSON file so a terminal session survives restarts. On file systems
 * with POSIX permissions the file is readable and writable by its owner only.
 */
@JBossLog
public class FileTokenStore implements TokenStore {

    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileTokenStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<StoredTokens> load() {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), StoredTokens.class));
        } catch (IOException e) {
            log.warnf("Ignoring unreadable token file %s: %s", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the tokens to an owner-only temporary file next to the target and moves it into
     * place, so the tokens are never visible with wider permissions.
     */
    @Override
    public synchronized void save(StoredTokens tokens) {
        Path directory = file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = POSIX
                    ? Files.createTempFile(directory, ".tokens", ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY))
                    : Files.createTempFile(directory, ".tokens", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                objectMapper.writeValue(out, tokens);
            }
            move(temp, file);
            temp = null;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write token file " + file, e);
        } finally {
            if (temp != null) deleteQuietly(temp);
        }
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete token file " + file, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warnf("Could not remove temporary token file %s: %s", temp, e.getMessage());
        }
    }

    public Path getFile() {
        return file;
    }
}
