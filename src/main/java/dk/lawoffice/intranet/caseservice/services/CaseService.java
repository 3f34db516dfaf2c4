package dk.lawoffice.intranet.caseservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.caseservice.dto.CaseDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseNoteDTO;
import dk.lawoffice.intranet.caseservice.model.CaseNote;
import dk.lawoffice.intranet.caseservice.model.LegalCase;
import dk.lawoffice.intranet.caseservice.model.enums.CaseStatus;
import dk.lawoffice.intranet.caseservice.repositories.CaseNoteRepository;
import dk.lawoffice.intranet.caseservice.repositories.CaseRepository;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.events.ActivityEvent;
import dk.lawoffice.intranet.events.ActivityType;
import dk.lawoffice.intranet.events.CaseDeletedEvent;
import dk.lawoffice.intranet.events.ClientDeletedEvent;
import dk.lawoffice.intranet.events.UserDeletedEvent;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.userservice.services.UserDirectory;
import dk.lawoffice.intranet.utils.JsonPatcher;
import dk.lawoffice.intranet.utils.RequestValidator;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@JBossLog
@ApplicationScoped
public class CaseService {

    @Inject
    CaseRepository caseRepository;

    @Inject
    CaseNoteRepository noteRepository;

    @Inject
    ClientRepository clientRepository;

    @Inject
    UserDirectory userDirectory;

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    @Inject
    Event<ActivityEvent> activityEvent;

    @Inject
    Event<CaseDeletedEvent> caseDeletedEvent;

    public PanacheQuery<LegalCase> list(String useruuid, CaseStatus status, String clientuuid, String search) {
        return caseRepository.findVisible(useruuid, status, clientuuid, search);
    }

    public LegalCase findVisible(String useruuid, String uuid) {
        return caseRepository.findVisible(uuid, useruuid)
                .orElseThrow(() -> new WebApplicationException("Case not found: " + uuid, Response.Status.NOT_FOUND));
    }

    @Transactional
    public LegalCase create(String useruuid, CaseDTO dto) {
        validator.validate(dto);
        Client client = ownedClient(useruuid, dto.getClient());
        LegalCase legalCase = new LegalCase();
        legalCase.setClientuuid(client.getUuid());
        legalCase.setTitle(dto.getTitle().trim());
        legalCase.setDescription(dto.getDescription());
        legalCase.setCreatedBy(useruuid);
        legalCase.setAssignedTo(validAssignees(dto.getAssignedTo()));
        legalCase.transitionTo(dto.getStatus() != null ? dto.getStatus() : CaseStatus.OPEN, LocalDateTime.now());
        caseRepository.persist(legalCase);
        log.infof("Created case: uuid=%s, title=%s, client=%s", legalCase.getUuid(), legalCase.getTitle(), client.getUuid());
        activityEvent.fire(new ActivityEvent(useruuid, ActivityType.CASE_CREATED,
                "Case " + legalCase.getTitle() + " opened for " + client.getFullName(), legalCase.getUuid()));
        return legalCase;
    }

    @Transactional
    public LegalCase update(String useruuid, String uuid, CaseDTO dto) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        validator.validate(dto);
        if (!dto.getClient().equals(legalCase.getClientuuid())) {
            legalCase.setClientuuid(ownedClient(useruuid, dto.getClient()).getUuid());
        }
        legalCase.setTitle(dto.getTitle().trim());
        legalCase.setDescription(dto.getDescription());
        if (dto.getAssignedTo() != null) {
            legalCase.getAssignedTo().clear();
            legalCase.getAssignedTo().addAll(validAssignees(dto.getAssignedTo()));
        }
        if (dto.getStatus() == CaseStatus.CLOSED || (dto.getStatus() != null && dto.getStatus() != legalCase.getStatus())) {
            changeStatus(useruuid, legalCase, dto.getStatus());
        } else {
            activityEvent.fire(new ActivityEvent(useruuid, ActivityType.CASE_UPDATED,
                    "Case " + legalCase.getTitle() + " updated", uuid));
        }
        log.infof("Updated case: uuid=%s", uuid);
        return legalCase;
    }

    @Transactional
    public LegalCase patch(String useruuid, String uuid, JsonNode patch) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        return update(useruuid, uuid, patcher.merge(toDTO(legalCase, false), patch));
    }

    /**
     * Closes the case and stamps the closing time, also when it was closed before.
     */
    @Transactional
    public LegalCase close(String useruuid, String uuid) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        changeStatus(useruuid, legalCase, CaseStatus.CLOSED);
        return legalCase;
    }

    /**
     * Adds the caller to the assignees. Assigning twice leaves a single assignment.
     */
    @Transactional
    public LegalCase assignToMe(String useruuid, String uuid) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        if (legalCase.getAssignedTo().add(useruuid)) {
            log.infof("Case %s assigned to %s", uuid, useruuid);
        } else {
            log.debugf("Case %s already assigned to %s", uuid, useruuid);
        }
        return legalCase;
    }

    @Transactional
    public CaseNote addNote(String useruuid, String uuid, CaseNoteDTO dto) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        validator.validate(dto);
        CaseNote note = new CaseNote(legalCase.getUuid(), dto.getContent(), useruuid);
        noteRepository.persist(note);
        log.infof("Added note %s to case %s", note.getUuid(), uuid);
        return note;
    }

    public List<CaseNote> notes(String useruuid, String uuid) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        return noteRepository.findByCase(legalCase.getUuid());
    }

    @Transactional
    public void delete(String useruuid, String uuid) {
        LegalCase legalCase = findVisible(useruuid, uuid);
        remove(legalCase);
        log.infof("Deleted case: %s", uuid);
    }

    void changeStatus(String useruuid, LegalCase legalCase, CaseStatus target) {
        CaseStatus previous = legalCase.getStatus();
        legalCase.transitionTo(target, LocalDateTime.now());
        log.infof("Case %s: %s -> %s", legalCase.getUuid(), previous, target);
        boolean closed = target == CaseStatus.CLOSED;
        activityEvent.fire(new ActivityEvent(useruuid, closed ? ActivityType.CASE_CLOSED : ActivityType.CASE_UPDATED,
                "Case " + legalCase.getTitle() + (closed ? " closed" : " moved to " + target.getLabel()), legalCase.getUuid()));
    }

    private void remove(LegalCase legalCase) {
        caseDeletedEvent.fire(new CaseDeletedEvent(legalCase.getUuid()));
        noteRepository.deleteByCase(legalCase.getUuid());
        caseRepository.delete(legalCase);
    }

    private Client ownedClient(String useruuid, String clientuuid) {
        return clientRepository.findOwned(clientuuid, useruuid)
                .orElseThrow(() -> ValidationException.of("client", "Invalid pk \"" + clientuuid + "\" - object does not exist."));
    }

    private Set<String> validAssignees(List<String> useruuids) {
        Set<String> result = new LinkedHashSet<>();
        if (useruuids == null) return result;
        for (String useruuid : useruuids) {
            if (!userDirectory.exists(useruuid)) {
                throw ValidationException.of("assigned_to", "Invalid pk \"" + useruuid + "\" - object does not exist.");
            }
            result.add(useruuid);
        }
        return result;
    }

    public CaseDTO toDTO(LegalCase legalCase) {
        return toDTO(legalCase, true);
    }

    CaseDTO toDTO(LegalCase legalCase, boolean withNotes) {
        List<String> assigned = new ArrayList<>(legalCase.getAssignedTo());
        Set<String> userIds = new LinkedHashSet<>(assigned);
        userIds.add(legalCase.getCreatedBy());
        List<CaseNote> notes = withNotes ? noteRepository.findByCase(legalCase.getUuid()) : List.of();
        notes.forEach(note -> userIds.add(note.getAuthor()));
        Map<String, String> names = userDirectory.fullNames(userIds);
        Client client = clientRepository.findById(legalCase.getClientuuid());

        return CaseDTO.builder()
                .uuid(legalCase.getUuid())
                .client(legalCase.getClientuuid())
                .clientName(client != null ? client.getFullName() : null)
                .title(legalCase.getTitle())
                .description(legalCase.getDescription())
                .status(legalCase.getStatus())
                .statusDisplay(legalCase.getStatus().getLabel())
                .createdBy(legalCase.getCreatedBy())
                .createdByName(names.get(legalCase.getCreatedBy()))
                .assignedTo(assigned)
                .assignedToNames(assigned.stream().map(names::get).filter(Objects::nonNull).collect(Collectors.toList()))
                .notes(notes.stream().map(note -> toNoteDTO(note, names.get(note.getAuthor()))).collect(Collectors.toList()))
                .createdAt(legalCase.getCreatedAt())
                .updatedAt(legalCase.getUpdatedAt())
                .closedAt(legalCase.getClosedAt())
                .build();
    }

    public CaseNoteDTO toNoteDTO(CaseNote note) {
        return toNoteDTO(note, userDirectory.fullName(note.getAuthor()));
    }

    private static CaseNoteDTO toNoteDTO(CaseNote note, String authorName) {
        return CaseNoteDTO.builder()
                .uuid(note.getUuid())
                .caseuuid(note.getCaseuuid())
                .content(note.getContent())
                .author(note.getAuthor())
                .authorName(authorName)
                .createdAt(note.getCreatedAt())
                .updatedAt(note.getUpdatedAt())
                .build();
    }

    void onClientDeleted(@Observes ClientDeletedEvent event) {
        List<LegalCase> cases = caseRepository.findByClient(event.clientuuid());
        cases.forEach(this::remove);
        log.debugf("Removed %d cases of deleted client %s", cases.size(), event.clientuuid());
    }

    void onUserDeleted(@Observes UserDeletedEvent event) {
        caseRepository.findAssignedTo(event.useruuid()).forEach(legalCase -> legalCase.getAssignedTo().remove(event.useruuid()));
        caseRepository.detachCreator(event.useruuid());
        noteRepository.detachAuthor(event.useruuid());
    }
}
