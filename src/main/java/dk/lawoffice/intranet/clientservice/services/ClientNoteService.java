package dk.lawoffice.intranet.clientservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientNoteDTO;
import dk.lawoffice.intranet.clientservice.dto.NotesSummaryDTO;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.model.ClientNote;
import dk.lawoffice.intranet.clientservice.repositories.ClientNoteRepository;
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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Notes on a client. Access goes through the owning client, so a note is only reachable by
 * the user who owns its client.
 */
@JBossLog
@ApplicationScoped
public class ClientNoteService {

    static final int RECENT_NOTES = 5;

    @Inject
    ClientService clientService;

    @Inject
    ClientNoteRepository noteRepository;

    @Inject
    UserDirectory userDirectory;

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    public PanacheQuery<ClientNote> list(String owner, String clientuuid) {
        clientService.findOwned(owner, clientuuid);
        return noteRepository.findByClient(clientuuid);
    }

    public ClientNote find(String owner, String clientuuid, String uuid) {
        clientService.findOwned(owner, clientuuid);
        return noteRepository.findByClientAndUuid(clientuuid, uuid)
                .orElseThrow(() -> new WebApplicationException("Note not found: " + uuid, Response.Status.NOT_FOUND));
    }

    @Transactional
    public ClientNote create(String owner, String clientuuid, ClientNoteDTO dto) {
        clientService.findOwned(owner, clientuuid);
        validator.validate(dto);
        ClientNote note = new ClientNote(clientuuid, dto.getTitle().trim(), dto.getContent(), owner);
        noteRepository.persist(note);
        log.infof("Created note %s on client %s", note.getUuid(), clientuuid);
        return note;
    }

    @Transactional
    public ClientNote update(String owner, String clientuuid, String uuid, ClientNoteDTO dto) {
        ClientNote note = find(owner, clientuuid, uuid);
        validator.validate(dto);
        note.setTitle(dto.getTitle().trim());
        note.setContent(dto.getContent());
        log.infof("Updated note %s on client %s", uuid, clientuuid);
        return note;
    }

    @Transactional
    public ClientNote patch(String owner, String clientuuid, String uuid, JsonNode patch) {
        ClientNote note = find(owner, clientuuid, uuid);
        return update(owner, clientuuid, uuid, patcher.merge(toDTO(note), patch));
    }

    @Transactional
    public void delete(String owner, String clientuuid, String uuid) {
        ClientNote note = find(owner, clientuuid, uuid);
        noteRepository.delete(note);
        log.infof("Deleted note %s on client %s", uuid, clientuuid);
    }

    public NotesSummaryDTO summary(String owner, String clientuuid) {
        Client client = clientService.findOwned(owner, clientuuid);
        List<ClientNote> recent = noteRepository.findRecentByClient(clientuuid, RECENT_NOTES);
        return NotesSummaryDTO.builder()
                .client(clientuuid)
                .clientName(client.getFullName())
                .totalNotes(noteRepository.countByClient(clientuuid))
                .latestNoteAt(recent.isEmpty() ? null : recent.get(0).getCreatedAt())
                .recentNotes(recent.stream().map(this::toDTO).collect(Collectors.toList()))
                .build();
    }

    public ClientNoteDTO toDTO(ClientNote note) {
        return ClientNoteDTO.builder()
                .uuid(note.getUuid())
                .client(note.getClientuuid())
                .title(note.getTitle())
                .content(note.getContent())
                .createdBy(note.getCreatedBy())
                .createdByName(userDirectory.fullName(note.getCreatedBy()))
                .createdAt(note.getCreatedAt())
                .updatedAt(note.getUpdatedAt())
                .build();
    }
}
