package dk.lawoffice.intranet.clientservice.repositories;

import dk.lawoffice.intranet.clientservice.model.Client;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Panache repository for clients. Every finder takes the owning user's uuid; a client created
 * by someone else is invisible through this repository.
 */
@ApplicationScoped
public class ClientRepository implements PanacheRepositoryBase<Client, String> {

    public static final Sort DEFAULT_SORT = Sort.by("lastName").and("firstName");

    public Optional<Client> findOwned(String uuid, String owner) {
        return find("uuid = ?1 AND createdBy = ?2", uuid, owner).firstResultOptional();
    }

    /**
     * @param search   case-insensitive substring over first name, last name, email and phone
     * @param active   optional active flag
     * @param city     optional exact city
     */
    public PanacheQuery<Client> search(String owner, String search, Boolean active, String city) {
        StringBuilder query = new StringBuilder("createdBy = :owner");
        Parameters params = Parameters.with("owner", owner);
        if (search != null && !search.isBlank()) {
            query.append(" AND (lower(firstName) LIKE :search OR lower(lastName) LIKE :search"
                    + " OR lower(email) LIKE :search OR lower(phone) LIKE :search)");
            params.and("search", "%" + search.trim().toLowerCase(Locale.ROOT) + "%");
        }
        if (active != null) {
            query.append(" AND active = :active");
            params.and("active", active);
        }
        if (city != null && !city.isBlank()) {
            query.append(" AND city = :city");
            params.and("city", city);
        }
        return find(query.toString(), DEFAULT_SORT, params);
    }

    public long countByOwner(String owner) {
        return count("createdBy", owner);
    }

    public long countByOwnerAndActive(String owner, boolean active) {
        return count("createdBy = ?1 AND active = ?2", owner, active);
    }

    public long countCreatedSince(String owner, LocalDateTime since) {
        return count("createdBy = ?1 AND createdAt >= ?2", owner, since);
    }

    public List<Client> findRecent(String owner, int limit) {
        return find("createdBy", Sort.descending("createdAt"), owner).page(0, limit).list();
    }

    public List<Client> findCreatedSince(String owner, LocalDateTime since) {
        return find("createdBy = ?1 AND createdAt >= ?2", Sort.ascending("createdAt"), owner, since).list();
    }

    /**
     * Cities with the most clients, blank cities excluded, ties broken alphabetically.
     *
     * @return rows of {@code [city, count]}
     */
    public List<Object[]> topCities(String owner, int limit) {
        return getEntityManager().createQuery(
                        "SELECT c.city, COUNT(c) FROM Client c WHERE c.createdBy = :owner AND c.city IS NOT NULL AND c.city <> ''"
                                + " GROUP BY c.city ORDER BY COUNT(c) DESC, c.city", Object[].class)
                .setParameter("owner", owner)
                .setMaxResults(limit)
                .getResultList();
    }

    public boolean emailTaken(String email, String excludeUuid) {
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (excludeUuid == null) {
            return count("lower(email) = ?1", normalized) > 0;
        }
        return count("lower(email) = ?1 AND uuid != ?2", normalized, excludeUuid) > 0;
    }

    public int detachCreator(String useruuid) {
        return update("createdBy = null WHERE createdBy = ?1", useruuid);
    }
}
