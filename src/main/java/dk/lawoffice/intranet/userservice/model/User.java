package dk.lawoffice.intranet.userservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.mindrot.jbcrypt.BCrypt;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A member of the office. Users authenticate with their email address.
 */
@Getter
@Setter
@ToString(exclude = "password")
@NoArgsConstructor
@Entity
@Table(name = "users")
public class User extends PanacheEntityBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "first_name", nullable = false, length = 150)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 150)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 20)
    private UserType userType = UserType.LAWYER;

    @JsonIgnore
    @Column(nullable = false)
    private String password;

    @Column(length = 20)
    private String phone;

    @Column(columnDefinition = "TEXT")
    private String address;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "date_joined", nullable = false, updatable = false)
    private LocalDateTime dateJoined;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public User(String email, String firstName, String lastName, UserType userType) {
        this.email = normalizeEmail(email);
        this.firstName = firstName;
        this.lastName = lastName;
        this.userType = userType;
    }

    @PrePersist
    protected void onCreate() {
        if (uuid == null) {
            uuid = UUID.randomUUID().toString();
        }
        dateJoined = LocalDateTime.now();
        updatedAt = dateJoined;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public String getFullName() {
        return (Objects.toString(firstName, "") + " " + Objects.toString(lastName, "")).trim();
    }

    public void setEmail(String email) {
        this.email = normalizeEmail(email);
    }

    public void setPasswordPlainText(String plainText) {
        this.password = BCrypt.hashpw(plainText, BCrypt.gensalt());
    }

    public boolean checkPassword(String passwordPlainText) {
        if (password == null || password.trim().isEmpty() || passwordPlainText == null) {
            return false;
        }
        return BCrypt.checkpw(passwordPlainText, password);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static Optional<User> findByEmail(String email) {
        if (email == null) return Optional.empty();
        return find("email", normalizeEmail(email)).firstResultOptional();
    }

    public static boolean emailTaken(String email, String excludeUuid) {
        if (excludeUuid == null) {
            return count("email", normalizeEmail(email)) > 0;
        }
        return count("email = ?1 AND uuid != ?2", normalizeEmail(email), excludeUuid) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        User user = (User) o;
        return uuid != null && uuid.equals(user.uuid);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
