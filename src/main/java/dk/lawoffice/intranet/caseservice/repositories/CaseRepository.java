package dk.lawoffice.intranet.caseservice.repositories;

import dk.lawoffice.intranet.caseservice.model.LegalCase;
import dk.lawoffice.intranet.caseservice.model.enums.CaseStatus;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Panache repository for cases. A case is visible to the user who created it and to every
 * user assigned to it.
 */
@ApplicationScoped
public class CaseRepository implements PanacheRepositoryBase<LegalCase, String> {

    private static final String VISIBLE = "(createdBy = :user OR :user MEMBER OF assignedTo)";

    public PanacheQuery<LegalCase> findVisible(String useruuid, CaseStatus status, String clientuuid, String search) {
        StringBuilder query = new StringBuilder(VISIBLE);
        Parameters params = Parameters.with("user", useruuid);
        if (status != null) {
            query.append(" AND status = :status");
            params.and("status", status);
        }
        if (clientuuid != null && !clientuuid.isBlank()) {
            query.append(" AND clientuuid = :client");
            params.and("client", clientuuid);
        }
        if (search != null && !search.isBlank()) {
            query.append(" AND lower(title) LIKE :search");
            params.and("search", "%" + search.trim().toLowerCase(Locale.ROOT) + "%");
        }
        return find(query.toString(), Sort.descending("createdAt"), params);
    }

    public Optional<LegalCase> findVisible(String uuid, String useruuid) {
        return find("uuid = :uuid AND " + VISIBLE, Parameters.with("uuid", uuid).and("user", useruuid)).firstResultOptional();
    }

    public List<LegalCase> findByClient(String clientuuid) {
        return list("clientuuid", clientuuid);
    }

    public List<LegalCase> findAssignedTo(String useruuid) {
        return list(":user MEMBER OF assignedTo", Parameters.with("user", useruuid));
    }

    public long countOpenVisible(String useruuid) {
        return count(VISIBLE + " AND status != :closed", Parameters.with("user", useruuid).and("closed", CaseStatus.CLOSED));
    }

    public int detachCreator(String useruuid) {
        return update("createdBy = null WHERE createdBy = ?1", useruuid);
    }
}
