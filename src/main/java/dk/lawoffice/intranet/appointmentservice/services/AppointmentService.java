package dk.lawoffice.intranet.appointmentservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentStatsDTO;
import dk.lawoffice.intranet.appointmentservice.model.Appointment;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.appointmentservice.repositories.AppointmentRepository;
import dk.lawoffice.intranet.caseservice.model.LegalCase;
import dk.lawoffice.intranet.caseservice.repositories.CaseRepository;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.events.ActivityEvent;
import dk.lawoffice.intranet.events.ActivityType;
import dk.lawoffice.intranet.events.CaseDeletedEvent;
import dk.lawoffice.intranet.events.ClientDeletedEvent;
import dk.lawoffice.intranet.events.UserDeletedEvent;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.invoiceservice.repositories.InvoiceRepository;
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
import java.util.List;

@JBossLog
@ApplicationScoped
public class AppointmentService {

    static final String END_BEFORE_START = "End time must be after start time.";
    static final int UPCOMING_DAYS = 7;
    static final int UPCOMING_LIMIT = 10;

    @Inject
    AppointmentRepository appointmentRepository;

    @Inject
    ClientRepository clientRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    InvoiceRepository invoiceRepository;

    @Inject
    UserDirectory userDirectory;

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    @Inject
    Event<ActivityEvent> activityEvent;

    public PanacheQuery<Appointment> search(String useruuid, AppointmentStatus status, LocalDateTime from, LocalDateTime to, String clientuuid) {
        return appointmentRepository.search(useruuid, status, from, to, clientuuid);
    }

    public Appointment findOwned(String useruuid, String uuid) {
        return appointmentRepository.findOwned(uuid, useruuid)
                .orElseThrow(() -> new WebApplicationException("Appointment not found: " + uuid, Response.Status.NOT_FOUND));
    }

    @Transactional
    public Appointment create(String useruuid, AppointmentDTO dto) {
        validator.validate(dto);
        checkTimes(dto);
        Appointment appointment = new Appointment();
        appointment.setUseruuid(useruuid);
        apply(useruuid, appointment, dto);
        appointment.setStatus(dto.getStatus() != null ? dto.getStatus() : AppointmentStatus.SCHEDULED);
        appointmentRepository.persist(appointment);
        log.infof("Created appointment: uuid=%s, start=%s, client=%s", appointment.getUuid(), appointment.getStartTime(), appointment.getClientuuid());
        activityEvent.fire(new ActivityEvent(useruuid, ActivityType.APPOINTMENT_CREATED,
                "Appointment " + appointment.getTitle() + " scheduled", appointment.getUuid()));
        return appointment;
    }

    @Transactional
    public Appointment update(String useruuid, String uuid, AppointmentDTO dto) {
        Appointment appointment = findOwned(useruuid, uuid);
        validator.validate(dto);
        checkTimes(dto);
        apply(useruuid, appointment, dto);
        if (dto.getStatus() != null && dto.getStatus() != appointment.getStatus()) {
            changeStatus(useruuid, appointment, dto.getStatus());
        } else {
            activityEvent.fire(new ActivityEvent(useruuid, ActivityType.APPOINTMENT_UPDATED,
                    "Appointment " + appointment.getTitle() + " updated", uuid));
        }
        log.infof("Updated appointment: uuid=%s", uuid);
        return appointment;
    }

    /**
     * Merges the patch into the stored appointment; the time check runs on the merged values.
     */
    @Transactional
    public Appointment patch(String useruuid, String uuid, JsonNode patch) {
        Appointment appointment = findOwned(useruuid, uuid);
        return update(useruuid, uuid, patcher.merge(toDTO(appointment), patch));
    }

    @Transactional
    public void delete(String useruuid, String uuid) {
        Appointment appointment = findOwned(useruuid, uuid);
        appointmentRepository.delete(appointment);
        log.infof("Deleted appointment: %s", uuid);
    }

    @Transactional
    public Appointment setStatus(String useruuid, String uuid, AppointmentStatus status) {
        Appointment appointment = findOwned(useruuid, uuid);
        changeStatus(useruuid, appointment, status);
        return appointment;
    }

    public List<Appointment> upcoming(String useruuid) {
        return appointmentRepository.findUpcoming(useruuid, LocalDateTime.now(), UPCOMING_LIMIT);
    }

    public List<Appointment> today(String useruuid) {
        LocalDateTime start = LocalDate.now().atStartOfDay();
        return appointmentRepository.findStartingBetween(useruuid, start, start.plusDays(1));
    }

    public List<Appointment> calendar(String useruuid, LocalDateTime from, LocalDateTime to) {
        return appointmentRepository.findStartingBetween(useruuid, from, to);
    }

    public List<Appointment> forClient(String useruuid, String clientuuid) {
        Client client = clientRepository.findOwned(clientuuid, useruuid)
                .orElseThrow(() -> new WebApplicationException("Client not found: " + clientuuid, Response.Status.NOT_FOUND));
        return appointmentRepository.findByUserAndClient(useruuid, client.getUuid());
    }

    public AppointmentStatsDTO stats(String useruuid) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime today = now.toLocalDate().atStartOfDay();
        return AppointmentStatsDTO.builder()
                .total(appointmentRepository.countByUser(useruuid))
                .today(appointmentRepository.countStartingBetween(useruuid, today, today.plusDays(1)))
                .upcoming(appointmentRepository.countUpcomingUntil(useruuid, now, now.plusDays(UPCOMING_DAYS)))
                .completed(appointmentRepository.countByStatus(useruuid, AppointmentStatus.COMPLETED))
                .activeClients(clientRepository.countByOwnerAndActive(useruuid, true))
                .totalRevenue(invoiceRepository.sumPaid(useruuid, null, null))
                .build();
    }

    void changeStatus(String useruuid, Appointment appointment, AppointmentStatus target) {
        AppointmentStatus previous = appointment.getStatus();
        appointment.setStatus(target);
        log.infof("Appointment %s: %s -> %s", appointment.getUuid(), previous, target);
        ActivityType type = switch (target) {
            case COMPLETED -> ActivityType.APPOINTMENT_COMPLETED;
            case CANCELLED -> ActivityType.APPOINTMENT_CANCELLED;
            default -> ActivityType.APPOINTMENT_UPDATED;
        };
        activityEvent.fire(new ActivityEvent(useruuid, type,
                "Appointment " + appointment.getTitle() + " " + target.getValue(), appointment.getUuid()));
    }

    private void apply(String useruuid, Appointment appointment, AppointmentDTO dto) {
        appointment.setTitle(dto.getTitle().trim());
        appointment.setDescription(dto.getDescription());
        appointment.setStartTime(dto.getStartTime());
        appointment.setEndTime(dto.getEndTime());
        appointment.setLocation(dto.getLocation());
        appointment.setNotes(dto.getNotes());
        appointment.setClientuuid(blank(dto.getClient()) ? null : ownedClient(useruuid, dto.getClient()).getUuid());
        appointment.setCaseuuid(blank(dto.getCaseuuid()) ? null : visibleCase(useruuid, dto.getCaseuuid()).getUuid());
    }

    private static void checkTimes(AppointmentDTO dto) {
        if (!dto.getStartTime().isBefore(dto.getEndTime())) {
            throw ValidationException.nonField(END_BEFORE_START);
        }
    }

    private Client ownedClient(String useruuid, String clientuuid) {
        return clientRepository.findOwned(clientuuid, useruuid)
                .orElseThrow(() -> ValidationException.of("client", "Invalid pk \"" + clientuuid + "\" - object does not exist."));
    }

    private LegalCase visibleCase(String useruuid, String caseuuid) {
        return caseRepository.findVisible(caseuuid, useruuid)
                .orElseThrow(() -> ValidationException.of("case", "Invalid pk \"" + caseuuid + "\" - object does not exist."));
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }

    public AppointmentDTO toDTO(Appointment appointment) {
        Client client = appointment.getClientuuid() != null ? clientRepository.findById(appointment.getClientuuid()) : null;
        LegalCase legalCase = appointment.getCaseuuid() != null ? caseRepository.findById(appointment.getCaseuuid()) : null;
        return AppointmentDTO.builder()
                .uuid(appointment.getUuid())
                .user(appointment.getUseruuid())
                .userName(userDirectory.fullName(appointment.getUseruuid()))
                .client(appointment.getClientuuid())
                .clientName(client != null ? client.getFullName() : null)
                .caseuuid(appointment.getCaseuuid())
                .caseTitle(legalCase != null ? legalCase.getTitle() : null)
                .title(appointment.getTitle())
                .description(appointment.getDescription())
                .startTime(appointment.getStartTime())
                .endTime(appointment.getEndTime())
                .status(appointment.getStatus())
                .statusDisplay(appointment.getStatus().getLabel())
                .location(appointment.getLocation())
                .notes(appointment.getNotes())
                .createdAt(appointment.getCreatedAt())
                .updatedAt(appointment.getUpdatedAt())
                .build();
    }

    void onClientDeleted(@Observes ClientDeletedEvent event) {
        int detached = appointmentRepository.detachClient(event.clientuuid());
        log.debugf("Detached %d appointments from deleted client %s", detached, event.clientuuid());
    }

    void onCaseDeleted(@Observes CaseDeletedEvent event) {
        appointmentRepository.detachCase(event.caseuuid());
    }

    void onUserDeleted(@Observes UserDeletedEvent event) {
        long removed = appointmentRepository.deleteByUser(event.useruuid());
        log.debugf("Removed %d appointments of deleted user %s", removed, event.useruuid());
    }
}
