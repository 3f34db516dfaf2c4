package dk.lawoffice.intranet.clientservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientDocumentDTO;
import dk.lawoffice.intranet.clientservice.model.ClientDocument;
import dk.lawoffice.intranet.clientservice.repositories.ClientDocumentRepository;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.userservice.services.UserDirectory;
import dk.lawoffice.intranet.utils.JsonPatcher;
import dk.lawoffice.intranet.utils.RequestValidator;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.io.InputStream;

@JBossLog
@ApplicationScoped
public class ClientDocumentService {

    @Inject
    ClientService clientService;

    @Inject
    ClientDocumentRepository documentRepository;

    @Inject
    DocumentStorage documentStorage;

    @Inject
    UserDirectory userDirectory;

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    public PanacheQuery<ClientDocument> list(String owner, String clientuuid) {
        clientService.findOwned(owner, clientuuid);
        return documentRepository.findByClient(clientuuid);
    }

    public ClientDocument find(String owner, String clientuuid, String uuid) {
        clientService.findOwned(owner, clientuuid);
        return documentRepository.findByClientAndUuid(clientuuid, uuid)
                .orElseThrow(() -> new WebApplicationException("Document not found: " + uuid, Response.Status.NOT_FOUND));
    }

    /**
     * Stores the uploaded bytes and records the document metadata.
     */
    @Transactional
    public ClientDocument upload(String owner, String clientuuid, ClientDocumentDTO metadata,
                                 String filename, String contentType, InputStream content) {
        clientService.findOwned(owner, clientuuid);
        if (content == null) {
            throw ValidationException.of("document", "No file was submitted.");
        }
        validator.validate(metadata);
        String storagePath = documentStorage.store(clientuuid, filename, content);

        ClientDocument document = new ClientDocument();
        document.setClientuuid(clientuuid);
        document.setTitle(metadata.getTitle().trim());
        document.setDescription(metadata.getDescription());
        document.setDocumentType(metadata.getDocumentType());
        document.setStoragePath(storagePath);
        document.setOriginalFilename(filename);
        document.setContentType(contentType);
        document.setSizeBytes(documentStorage.size(storagePath));
        document.setUploadedBy(owner);
        documentRepository.persist(document);
        log.infof("Uploaded document %s (%d bytes) for client %s", document.getUuid(), document.getSizeBytes(), clientuuid);
        return document;
    }

    @Transactional
    public ClientDocument patch(String owner, String clientuuid, String uuid, JsonNode patch) {
        ClientDocument document = find(owner, clientuuid, uuid);
        ClientDocumentDTO merged = validator.validate(patcher.merge(toDTO(document), patch));
        document.setTitle(merged.getTitle().trim());
        document.setDescription(merged.getDescription());
        document.setDocumentType(merged.getDocumentType());
        log.infof("Updated document %s", uuid);
        return document;
    }

    @Transactional
    public void delete(String owner, String clientuuid, String uuid) {
        ClientDocument document = find(owner, clientuuid, uuid);
        documentStorage.delete(document.getStoragePath());
        documentRepository.delete(document);
        log.infof("Deleted document %s of client %s", uuid, clientuuid);
    }

    public InputStream open(ClientDocument document) {
        return documentStorage.open(document.getStoragePath());
    }

    public ClientDocumentDTO toDTO(ClientDocument document) {
        return ClientDocumentDTO.builder()
                .uuid(document.getUuid())
                .client(document.getClientuuid())
                .title(document.getTitle())
                .description(document.getDescription())
                .documentType(document.getDocumentType())
                .filename(document.getOriginalFilename())
                .contentType(document.getContentType())
                .sizeBytes(document.getSizeBytes())
                .downloadUrl("/clients/" + document.getClientuuid() + "/documents/" + document.getUuid() + "/download")
                .uploadedBy(document.getUploadedBy())
                .uploadedByName(userDirectory.fullName(document.getUploadedBy()))
                .uploadedAt(document.getUploadedAt())
                .build();
    }
}
