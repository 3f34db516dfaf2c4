package dk.lawoffice.intranet.caseservice.model;

import dk.lawoffice.intranet.caseservice.model.enums.CaseStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A legal matter handled for a client. Visible to its creator and to every assigned user.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Entity
@Table(name = "cases", indexes = {
        @Index(name = "idx_cases_client", columnList = "clientuuid"),
        @Index(name = "idx_cases_created_by", columnList = "created_by")
})
public class LegalCase extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String clientuuid;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CaseStatus status = CaseStatus.OPEN;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "case_assignments", joinColumns = @JoinColumn(name = "caseuuid"))
    @Column(name = "useruuid", length = 36)
    private Set<String> assignedTo = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

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

    /**
     * Moves the case to {@code target}. Every transition to closed stamps {@code closedAt},
     * also when the case was already closed; any other status clears it.
     */
    public void transitionTo(CaseStatus target, LocalDateTime now) {
        this.status = target;
        this.closedAt = target == CaseStatus.CLOSED ? now : null;
    }

    public boolean isVisibleTo(String useruuid) {
        return useruuid != null && (useruuid.equals(createdBy) || assignedTo.contains(useruuid));
    }
}
