package dk.lawoffice.intranet.userservice.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Server-side record of an issued refresh token, keyed by the token's {@code jti} claim.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "refresh_tokens", indexes = @Index(name = "idx_refresh_tokens_user", columnList = "useruuid"))
public class RefreshToken extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String jti;

    @Column(nullable = false, length = 36)
    private String useruuid;

    @Column(name = "issued_at", nullable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean revoked;

    public RefreshToken(String jti, String useruuid, LocalDateTime issuedAt, LocalDateTime expiresAt) {
        this.jti = jti;
        this.useruuid = useruuid;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isUsable(LocalDateTime now) {
        return !revoked && expiresAt.isAfter(now);
    }

    public static long deleteByUser(String useruuid) {
        return delete("useruuid", useruuid);
    }

    public static long revokeAllForUser(String useruuid) {
        return update("revoked = true where useruuid = ?1 and revoked = false", useruuid);
    }
}
