package dk.lawoffice.intranet.bootstrap;

import dk.lawoffice.intranet.appointmentservice.model.Appointment;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.appointmentservice.repositories.AppointmentRepository;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.model.ClientNote;
import dk.lawoffice.intranet.clientservice.repositories.ClientNoteRepository;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.userservice.model.User;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;

/**
 * Inserts demo users, clients and appointments at startup when {@code lawoffice.seed.enabled}
 * is set. Rows that already exist are left alone, so restarting does not duplicate data.
 */
@JBossLog
@ApplicationScoped
public class SampleDataSeeder {

    static final int APPOINTMENT_COUNT = 20;
    static final int APPOINTMENT_DAYS = 30;

    @ConfigProperty(name = "lawoffice.seed.enabled", defaultValue = "false")
    boolean enabled;

    @Inject
    ClientRepository clientRepository;

    @Inject
    ClientNoteRepository noteRepository;

    @Inject
    AppointmentRepository appointmentRepository;

    void onStart(@Observes StartupEvent ev) {
        if (!enabled) return;
        log.info("Creating sample data...");
        seed();
        log.info("Sample data created");
    }

    @Transactional
    public void seed() {
        User john = user("john.doe@lawfirm.com", "John", "Doe", UserType.LAWYER, "password123");
        User jane = user("jane.smith@lawfirm.com", "Jane", "Smith", UserType.PARALEGAL, "password123");
        User admin = user("admin@lawfirm.com", "Admin", "User", UserType.ADMIN, "admin123");

        List<Client> clients = List.of(
                client(john, "Michael", "Johnson", "michael.j@email.com", "+1-555-0101", "123 Main St", "New York", "NY", "10001", LocalDate.of(1980, 5, 15)),
                client(john, "Sarah", "Williams", "sarah.w@email.com", "+1-555-0102", "456 Oak Ave", "Los Angeles", "CA", "90001", LocalDate.of(1985, 8, 22)),
                client(john, "Robert", "Brown", "robert.b@email.com", "+1-555-0103", "789 Pine Rd", "Chicago", "IL", "60007", LocalDate.of(1975, 3, 10)),
                client(john, "Emily", "Davis", "emily.d@email.com", "+1-555-0104", "321 Elm St", "Houston", "TX", "77001", LocalDate.of(1990, 12, 5)),
                client(john, "James", "Miller", "james.m@email.com", "+1-555-0105", "654 Maple Dr", "Phoenix", "AZ", "85001", LocalDate.of(1982, 7, 18)));

        appointments(List.of(john, jane, admin), clients);
    }

    User user(String email, String firstName, String lastName, UserType type, String password) {
        return User.findByEmail(email).orElseGet(() -> {
            User user = new User(email, firstName, lastName, type);
            user.setPasswordPlainText(password);
            user.persist();
            log.infof("  Created user: %s", email);
            return user;
        });
    }

    Client client(User owner, String firstName, String lastName, String email, String phone,
                  String address, String city, String state, String postalCode, LocalDate dateOfBirth) {
        if (clientRepository.emailTaken(email, null)) {
            log.debugf("  Client already exists: %s", email);
            return clientRepository.find("lower(email) = ?1", email.toLowerCase(Locale.ROOT)).firstResult();
        }
        Client client = new Client();
        client.setFirstName(firstName);
        client.setLastName(lastName);
        client.setEmail(email);
        client.setPhone(phone);
        client.setAddress(address);
        client.setCity(city);
        client.setState(state);
        client.setPostalCode(postalCode);
        client.setCountry("USA");
        client.setDateOfBirth(dateOfBirth);
        client.setCreatedBy(owner.getUuid());
        clientRepository.persist(client);
        noteRepository.persist(new ClientNote(client.getUuid(), "Initial Consultation",
                "Initial consultation with " + client.getFullName() + ".", owner.getUuid()));
        log.infof("  Created client: %s", client.getFullName());
        return client;
    }

    /**
     * One-hour appointments on working hours spread over the next 30 days. The schedule is
     * derived from the index so the same slots are produced on every start of the same day.
     */
    void appointments(List<User> users, List<Client> clients) {
        LocalDate today = LocalDate.now();
        int[] minutes = {0, 15, 30, 45};
        int created = 0;
        for (int i = 0; i < APPOINTMENT_COUNT; i++) {
            User user = users.get(i % users.size());
            LocalDate day = today.plusDays(1 + (i * 7L) % APPOINTMENT_DAYS);
            LocalDateTime start = LocalDateTime.of(day, LocalTime.of(9 + i % 8, minutes[i % minutes.length]));
            if (appointmentRepository.count("useruuid = ?1 AND startTime = ?2", user.getUuid(), start) > 0) continue;
            Appointment appointment = new Appointment();
            appointment.setUseruuid(user.getUuid());
            appointment.setTitle("Consultation with " + user.getFullName());
            appointment.setDescription("Appointment for " + user.getFullName() + ".");
            appointment.setStartTime(start);
            appointment.setEndTime(start.plusHours(1));
            appointment.setStatus(i % 2 == 0 ? AppointmentStatus.SCHEDULED : AppointmentStatus.CONFIRMED);
            Client client = clients.get(i % clients.size());
            if (user.getUuid().equals(client.getCreatedBy())) {
                appointment.setClientuuid(client.getUuid());
            }
            appointmentRepository.persist(appointment);
            created++;
        }
        log.infof("  Created %d appointments", created);
    }
}
