package dk.lawoffice.intranet.appointmentservice.model;

import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A meeting in a user's calendar, optionally with a client and about a case.
 * Overlapping appointments are allowed.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Entity
@Table(name = "appointments", indexes = {
        @Index(name = "idx_appointments_user_start", columnList = "useruuid, start_time"),
        @Index(name = "idx_appointments_client", columnList = "clientuuid")
})
public class Appointment extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String useruuid;

    @Column(length = 36)
    private String clientuuid;

    @Column(length = 36)
    private String caseuuid;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    @Column(length = 200)
    private String location;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (uuid == null) {
            uuid = UUID.randomUUID().toString();
        }
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
