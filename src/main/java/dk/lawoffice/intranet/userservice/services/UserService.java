package dk.lawoffice.intranet.userservice.services;

import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.userservice.dto.ChangePasswordRequest;
import dk.lawoffice.intranet.userservice.dto.UserCreateRequest;
import dk.lawoffice.intranet.userservice.dto.UserUpdateRequest;
import dk.lawoffice.intranet.events.UserDeletedEvent;
import dk.lawoffice.intranet.userservice.model.RefreshToken;
import dk.lawoffice.intranet.userservice.model.User;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@ApplicationScoped
public class UserService {

    static final String EMAIL_TAKEN = "user with this email already exists.";

    @Inject
    Event<UserDeletedEvent> userDeletedEvent;

    public PanacheQuery<User> listAll() {
        return User.findAll(Sort.by("lastName").and("firstName"));
    }

    public User findByUuid(String uuid) {
        User user = User.findById(uuid);
        if (user == null) {
            throw new WebApplicationException("User not found: " + uuid, Response.Status.NOT_FOUND);
        }
        return user;
    }

    /**
     * Public self-registration. Administrator accounts can only be created by an administrator.
     */
    @Transactional
    public User register(UserCreateRequest request) {
        if (request.getUserType() == UserType.ADMIN) {
            throw ValidationException.of("user_type", "Administrator accounts cannot be self-registered.");
        }
        return create(request);
    }

    @Transactional
    public User create(UserCreateRequest request) {
        if (request.getPasswordConfirm() != null && !request.getPasswordConfirm().equals(request.getPassword())) {
            throw ValidationException.of("password", "Password fields didn't match.");
        }
        if (User.emailTaken(request.getEmail(), null)) {
            throw ValidationException.of("email", EMAIL_TAKEN);
        }
        User user = new User(request.getEmail(), request.getFirstName().trim(), request.getLastName().trim(),
                request.getUserType() != null ? request.getUserType() : UserType.LAWYER);
        user.setPasswordPlainText(request.getPassword());
        user.setPhone(request.getPhone());
        user.setAddress(request.getAddress());
        user.setDateOfBirth(request.getDateOfBirth());
        user.persist();
        log.infof("Created user: uuid=%s, email=%s, type=%s", user.getUuid(), user.getEmail(), user.getUserType());
        return user;
    }

    /**
     * Applies the non-null fields of the request. Only administrators may change the account
     * type or the active flag.
     */
    @Transactional
    public User update(String uuid, UserUpdateRequest request, boolean callerIsAdmin) {
        User user = findByUuid(uuid);
        if (!callerIsAdmin && (request.getUserType() != null || request.getActive() != null)) {
            throw new WebApplicationException("Only administrators can change user_type or is_active", Response.Status.FORBIDDEN);
        }
        if (request.getEmail() != null) {
            if (User.emailTaken(request.getEmail(), uuid)) {
                throw ValidationException.of("email", EMAIL_TAKEN);
            }
            user.setEmail(request.getEmail());
        }
        if (request.getFirstName() != null) user.setFirstName(request.getFirstName().trim());
        if (request.getLastName() != null) user.setLastName(request.getLastName().trim());
        if (request.getPhone() != null) user.setPhone(request.getPhone());
        if (request.getAddress() != null) user.setAddress(request.getAddress());
        if (request.getDateOfBirth() != null) user.setDateOfBirth(request.getDateOfBirth());
        if (request.getUserType() != null) user.setUserType(request.getUserType());
        if (request.getActive() != null) {
            user.setActive(request.getActive());
            if (!user.isActive()) RefreshToken.revokeAllForUser(uuid);
        }
        log.infof("Updated user: uuid=%s", uuid);
        return user;
    }

    @Transactional
    public void changePassword(String uuid, ChangePasswordRequest request) {
        User user = findByUuid(uuid);
        if (!user.checkPassword(request.getOldPassword())) {
            log.warnf("Password change for %s rejected: wrong old password", user.getEmail());
            throw ValidationException.of("old_password", "Wrong password.");
        }
        user.setPasswordPlainText(request.getNewPassword());
        log.infof("Password changed for %s", user.getEmail());
    }

    @Transactional
    public void delete(String uuid) {
        User user = findByUuid(uuid);
        userDeletedEvent.fire(new UserDeletedEvent(uuid));
        RefreshToken.deleteByUser(uuid);
        user.delete();
        log.infof("Deleted user: %s", uuid);
    }
}
