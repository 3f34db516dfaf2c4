package dk.lawoffice.intranet.clientservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientStatsDTO;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.repositories.ClientDocumentRepository;
import dk.lawoffice.intranet.clientservice.repositories.ClientNoteRepository;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.events.ActivityEvent;
import dk.lawoffice.intranet.events.ActivityType;
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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

@JBossLog
@ApplicationScoped
public class ClientService {

    static final String EMAIL_TAKEN = "client with this email already exists.";
    static final int TOP_CITIES = 5;

    @Inject
    ClientRepository clientRepository;

    @Inject
    ClientNoteRepository noteRepository;

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

    @Inject
    Event<ActivityEvent> activityEvent;

    @Inject
    Event<ClientDeletedEvent> clientDeletedEvent;

    public PanacheQuery<Client> search(String owner, String search, Boolean active, String city) {
        return clientRepository.search(owner, search, active, city);
    }

    public Client findOwned(String owner, String uuid) {
        return clientRepository.findOwned(uuid, owner)
                .orElseThrow(() -> new WebApplicationException("Client not found: " + uuid, Response.Status.NOT_FOUND));
    }

    @Transactional
    public Client create(String owner, ClientDTO dto) {
        validator.validate(dto);
        checkEmail(dto.getEmail(), null);
        Client client = new Client();
        apply(client, dto);
        client.setActive(dto.getActive() == null || dto.getActive());
        client.setCreatedBy(owner);
        clientRepository.persist(client);
        log.infof("Created client: uuid=%s, name=%s", client.getUuid(), client.getFullName());
        activityEvent.fire(new ActivityEvent(owner, ActivityType.CLIENT_CREATED,
                "New client " + client.getFullName() + " added", client.getUuid()));
        return client;
    }

    @Transactional
    public Client update(String owner, String uuid, ClientDTO dto) {
        Client client = findOwned(owner, uuid);
        validator.validate(dto);
        checkEmail(dto.getEmail(), uuid);
        apply(client, dto);
        if (dto.getActive() != null) client.setActive(dto.getActive());
        log.infof("Updated client: uuid=%s", uuid);
        activityEvent.fire(new ActivityEvent(owner, ActivityType.CLIENT_UPDATED,
                "Client " + client.getFullName() + " updated", uuid));
        return client;
    }

    @Transactional
    public Client patch(String owner, String uuid, JsonNode patch) {
        Client client = findOwned(owner, uuid);
        ClientDTO merged = patcher.merge(toDTO(client), patch);
        return update(owner, uuid, merged);
    }

    @Transactional
    public Client setActive(String owner, String uuid, boolean active) {
        Client client = findOwned(owner, uuid);
        client.setActive(active);
        log.infof("Client %s %s", uuid, active ? "activated" : "deactivated");
        activityEvent.fire(new ActivityEvent(owner, ActivityType.CLIENT_UPDATED,
                "Client " + client.getFullName() + (active ? " activated" : " deactivated"), uuid));
        return client;
    }

    /**
     * Removes the client with its notes and documents. Cases and invoices of the client are
     * removed and appointments are detached by the observers of {@link ClientDeletedEvent}.
     */
    @Transactional
    public void delete(String owner, String uuid) {
        Client client = findOwned(owner, uuid);
        clientDeletedEvent.fire(new ClientDeletedEvent(uuid));
        noteRepository.deleteByClient(uuid);
        documentRepository.listByClient(uuid).forEach(document -> {
            documentStorage.delete(document.getStoragePath());
            documentRepository.delete(document);
        });
        clientRepository.delete(client);
        log.infof("Deleted client: %s", uuid);
        activityEvent.fire(new ActivityEvent(owner, ActivityType.CLIENT_DELETED,
                "Client " + client.getFullName() + " deleted", uuid));
    }

    public ClientStatsDTO stats(String owner) {
        LocalDateTime monthStart = LocalDate.now().withDayOfMonth(1).atStartOfDay();
        return ClientStatsDTO.builder()
                .totalClients(clientRepository.countByOwner(owner))
                .activeClients(clientRepository.countByOwnerAndActive(owner, true))
                .inactiveClients(clientRepository.countByOwnerAndActive(owner, false))
                .newClientsThisMonth(clientRepository.countCreatedSince(owner, monthStart))
                .topCities(clientRepository.topCities(owner, TOP_CITIES).stream()
                        .map(row -> new ClientStatsDTO.CityCount((String) row[0], ((Number) row[1]).longValue()))
                        .collect(Collectors.toList()))
                .build();
    }

    public ClientDTO toDTO(Client client) {
        return ClientDTO.builder()
                .uuid(client.getUuid())
                .firstName(client.getFirstName())
                .lastName(client.getLastName())
                .fullName(client.getFullName())
                .email(client.getEmail())
                .phone(client.getPhone())
                .address(client.getAddress())
                .city(client.getCity())
                .state(client.getState())
                .postalCode(client.getPostalCode())
                .country(client.getCountry())
                .dateOfBirth(client.getDateOfBirth())
                .occupation(client.getOccupation())
                .company(client.getCompany())
                .active(client.isActive())
                .createdBy(client.getCreatedBy())
                .createdByName(userDirectory.fullName(client.getCreatedBy()))
                .createdAt(client.getCreatedAt())
                .updatedAt(client.getUpdatedAt())
                .build();
    }

    void onUserDeleted(@Observes UserDeletedEvent event) {
        int clients = clientRepository.detachCreator(event.useruuid());
        noteRepository.detachCreator(event.useruuid());
        documentRepository.detachUploader(event.useruuid());
        log.debugf("Detached %d clients from deleted user %s", clients, event.useruuid());
    }

    private void checkEmail(String email, String excludeUuid) {
        if (email != null && !email.isBlank() && clientRepository.emailTaken(email, excludeUuid)) {
            throw ValidationException.of("email", EMAIL_TAKEN);
        }
    }

    private static void apply(Client client, ClientDTO dto) {
        client.setFirstName(dto.getFirstName().trim());
        client.setLastName(dto.getLastName().trim());
        client.setEmail(dto.getEmail() == null || dto.getEmail().isBlank() ? null : dto.getEmail().trim());
        client.setPhone(dto.getPhone());
        client.setAddress(dto.getAddress());
        client.setCity(dto.getCity());
        client.setState(dto.getState());
        client.setPostalCode(dto.getPostalCode());
        client.setCountry(dto.getCountry());
        client.setDateOfBirth(dto.getDateOfBirth());
        client.setOccupation(dto.getOccupation());
        client.setCompany(dto.getCompany());
    }
}
