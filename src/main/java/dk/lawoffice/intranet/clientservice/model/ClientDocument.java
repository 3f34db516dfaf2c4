package dk.lawoffice.intranet.clientservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Metadata of a file attached to a client. The bytes live on disk under
 * {@code <documents root>/<client uuid>/}; {@link #storagePath} is relative to the root.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "client_documents", indexes = @Index(name = "idx_client_documents_client", columnList = "clientuuid"))
public class ClientDocument extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 36)
    private String clientuuid;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "document_type", length = 50)
    private String documentType;

    @Column(name = "storage_path", nullable = false, length = 500)
    private String storagePath;

    @Column(name = "original_filename", length = 255)
    private String originalFilename;

    @Column(name = "content_type", length = 100)
    private String contentType;

    @Column(name = "size_bytes")
    private long sizeBytes;

    @Column(name = "uploaded_by", length = 36)
    private String uploadedBy;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    @PrePersist
    protected void onCreate() {
        if (uuid == null) {
            uuid = UUID.randomUUID().toString();
        }
        uploadedAt = LocalDateTime.now();
    }
}
