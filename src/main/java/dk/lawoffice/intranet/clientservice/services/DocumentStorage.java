package dk.lawoffice.intranet.clientservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Stores client document bytes on the local filesystem under
 * {@code lawoffice.documents.root/<client uuid>/}.
 */
@JBossLog
@ApplicationScoped
public class DocumentStorage {

    @ConfigProperty(name = "lawoffice.documents.root")
    String root;

    /**
     * @return the stored file's path relative to the documents root
     */
    public String store(String clientuuid, String filename, InputStream content) {
        String safeName = sanitize(filename);
        Path relative = Paths.get(clientuuid, UUID.randomUUID() + "_" + safeName);
        Path target = resolve(relative.toString());
        try {
            Files.createDirectories(target.getParent());
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new DocumentStorageException("Could not store document " + safeName + " for client " + clientuuid, e);
        }
        log.debugf("Stored document %s", target);
        return relative.toString();
    }

    public InputStream open(String storagePath) {
        Path file = resolve(storagePath);
        if (!Files.isRegularFile(file)) {
            throw new WebApplicationException("Document file is missing", Response.Status.NOT_FOUND);
        }
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new DocumentStorageException("Could not read document " + storagePath, e);
        }
    }

    public long size(String storagePath) {
        try {
            return Files.size(resolve(storagePath));
        } catch (IOException e) {
            throw new DocumentStorageException("Could not read document " + storagePath, e);
        }
    }

    public void delete(String storagePath) {
        try {
            Files.deleteIfExists(resolve(storagePath));
        } catch (IOException e) {
            log.warnf(e, "Could not delete document file %s", storagePath);
        }
    }

    Path resolve(String storagePath) {
        Path base = Paths.get(root).toAbsolutePath().normalize();
        Path file = base.resolve(storagePath).normalize();
        if (!file.startsWith(base)) {
            throw new WebApplicationException("Invalid document path", Response.Status.BAD_REQUEST);
        }
        return file;
    }

    static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) return "document";
        String name = Paths.get(filename.replace('\\', '/')).getFileName().toString();
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
