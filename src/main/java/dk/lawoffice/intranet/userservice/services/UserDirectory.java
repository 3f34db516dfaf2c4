package dk.lawoffice.intranet.userservice.services;

import dk.lawoffice.intranet.userservice.model.User;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves user uuids to display names for the {@code *_name} fields of the API.
 */
@ApplicationScoped
public class UserDirectory {

    public String fullName(String useruuid) {
        if (useruuid == null) return null;
        User user = User.findById(useruuid);
        return user != null ? user.getFullName() : null;
    }

    public Map<String, String> fullNames(Collection<String> useruuids) {
        List<String> ids = useruuids.stream().filter(Objects::nonNull).distinct().collect(Collectors.toList());
        if (ids.isEmpty()) return new HashMap<>();
        return User.<User>list("uuid IN (?1)", ids).stream()
                .collect(Collectors.toMap(User::getUuid, User::getFullName));
    }

    public boolean exists(String useruuid) {
        return useruuid != null && User.findById(useruuid) != null;
    }
}
