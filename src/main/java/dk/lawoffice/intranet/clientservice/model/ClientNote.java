package dk.lawoffice.intranet.clientservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "client_notes", indexes = @Index(name = "idx_client_notes_client", columnList = "clientuuid"))
public class ClientNote extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String clientuuid;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public ClientNote(String clientuuid, String title, String content, String createdBy) {
        this.clientuuid = clientuuid;
        this.title = title;
        this.content = content;
        this.createdBy = createdBy;
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
