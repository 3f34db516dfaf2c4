package dk.lawoffice.intranet.appointmentservice.repositories;

import dk.lawoffice.intranet.appointmentservice.model.Appointment;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Panache repository for appointments. All finders are scoped to the owning user.
 */
@ApplicationScoped
public class AppointmentRepository implements PanacheRepositoryBase<Appointment, String> {

    public Optional<Appointment> findOwned(String uuid, String useruuid) {
        return find("uuid = ?1 AND useruuid = ?2", uuid, useruuid).firstResultOptional();
    }

    /**
     * @param from start of the start-time window (inclusive), may be null
     * @param to   end of the start-time window (exclusive), may be null
     */
    public PanacheQuery<Appointment> search(String useruuid, AppointmentStatus status, LocalDateTime from, LocalDateTime to, String clientuuid) {
        StringBuilder query = new StringBuilder("useruuid = :user");
        Parameters params = Parameters.with("user", useruuid);
        if (status != null) {
            query.append(" AND status = :status");
            params.and("status", status);
        }
        if (from != null) {
            query.append(" AND startTime >= :from");
            params.and("from", from);
        }
        if (to != null) {
            query.append(" AND startTime < :to");
            params.and("to", to);
        }
        if (clientuuid != null && !clientuuid.isBlank()) {
            query.append(" AND clientuuid = :client");
            params.and("client", clientuuid);
        }
        return find(query.toString(), Sort.descending("startTime"), params);
    }

    public List<Appointment> findUpcoming(String useruuid, LocalDateTime now, int limit) {
        return find("useruuid = ?1 AND startTime > ?2 AND status IN (?3)", Sort.ascending("startTime"),
                useruuid, now, AppointmentStatus.PENDING).page(0, limit).list();
    }

    public List<Appointment> findStartingBetween(String useruuid, LocalDateTime from, LocalDateTime to) {
        return list("useruuid = ?1 AND startTime >= ?2 AND startTime < ?3", Sort.ascending("startTime"), useruuid, from, to);
    }

    public long countByUser(String useruuid) {
        return count("useruuid", useruuid);
    }

    public long countByStatus(String useruuid, AppointmentStatus status) {
        return count("useruuid = ?1 AND status = ?2", useruuid, status);
    }

    public long countUpcoming(String useruuid, LocalDateTime now) {
        return count("useruuid = ?1 AND startTime > ?2 AND status IN (?3)", useruuid, now, AppointmentStatus.PENDING);
    }

    public long countUpcomingUntil(String useruuid, LocalDateTime now, LocalDateTime until) {
        return count("useruuid = ?1 AND startTime > ?2 AND startTime <= ?3 AND status IN (?4)",
                useruuid, now, until, AppointmentStatus.PENDING);
    }

    public long countStartingBetween(String useruuid, LocalDateTime from, LocalDateTime to) {
        return count("useruuid = ?1 AND startTime >= ?2 AND startTime < ?3", useruuid, from, to);
    }

    public List<Appointment> findByUserAndClient(String useruuid, String clientuuid) {
        return list("useruuid = ?1 AND clientuuid = ?2", Sort.descending("startTime"), useruuid, clientuuid);
    }

    public int detachClient(String clientuuid) {
        return update("clientuuid = null WHERE clientuuid = ?1", clientuuid);
    }

    public int detachCase(String caseuuid) {
        return update("caseuuid = null WHERE caseuuid = ?1", caseuuid);
    }

    public long deleteByUser(String useruuid) {
        return delete("useruuid", useruuid);
    }
}
