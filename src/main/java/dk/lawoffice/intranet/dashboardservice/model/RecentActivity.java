package dk.lawoffice.intranet.dashboardservice.model;

import dk.lawoffice.intranet.events.ActivityType;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@ToString
@NoArgsConstructor
@Entity
@Table(name = "recent_activities", indexes = @Index(name = "idx_recent_activities_user_created", columnList = "useruuid, created_at"))
public class RecentActivity extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String useruuid;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 30)
    private ActivityType activityType;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "related_object_id", length = 36)
    private String relatedObjectId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public RecentActivity(String useruuid, ActivityType activityType, String description, String relatedObjectId) {
        this.useruuid = useruuid;
        this.activityType = activityType;
        this.description = description;
        this.relatedObjectId = relatedObjectId;
    }

    @PrePersist
    protected void onCreate() {
        if (uuid == null) {
            uuid = UUID.randomUUID().toString();
        }
        createdAt = LocalDateTime.now();
    }
}
