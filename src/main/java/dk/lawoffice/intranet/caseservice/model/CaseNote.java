package dk.lawoffice.intranet.caseservice.model;

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
@Table(name = "case_notes", indexes = @Index(name = "idx_case_notes_case", columnList = "caseuuid"))
public class CaseNote extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String caseuuid;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(length = 36)
    private String author;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public CaseNote(String caseuuid, String content, String author) {
        this.caseuuid = caseuuid;
        this.content = content;
        this.author = author;
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
