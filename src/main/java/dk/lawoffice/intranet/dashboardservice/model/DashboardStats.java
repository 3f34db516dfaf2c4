package dk.lawoffice.intranet.dashboardservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Daily snapshot of a user's counters. One row per user and day; the row of the current day
 * is rewritten after every recorded activity.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Entity
@Table(name = "dashboard_stats", uniqueConstraints = @UniqueConstraint(name = "uk_dashboard_stats_user_date", columnNames = {"useruuid", "stat_date"}))
public class DashboardStats extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String useruuid;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Column(name = "total_clients")
    private long totalClients;

    @Column(name = "total_appointments")
    private long totalAppointments;

    @Column(name = "upcoming_appointments")
    private long upcomingAppointments;

    @Column(name = "completed_appointments")
    private long completedAppointments;

    @Column(name = "cancelled_appointments")
    private long cancelledAppointments;

    @Column(name = "new_clients_this_month")
    private long newClientsThisMonth;

    @Column(name = "revenue_this_month", nullable = false, precision = 12, scale = 2)
    private BigDecimal revenueThisMonth = BigDecimal.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public DashboardStats(String useruuid, LocalDate statDate) {
        this.useruuid = useruuid;
        this.statDate = statDate;
    }

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
