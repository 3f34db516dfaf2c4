package dk.lawoffice.intranet.dashboardservice.repositories;

import dk.lawoffice.intranet.dashboardservice.model.DashboardStats;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class DashboardStatsRepository implements PanacheRepositoryBase<DashboardStats, String> {

    public Optional<DashboardStats> findByUserAndDate(String useruuid, LocalDate date) {
        return find("useruuid = ?1 AND statDate = ?2", useruuid, date).firstResultOptional();
    }

    public List<DashboardStats> findLatest(String useruuid, int limit) {
        return find("useruuid", Sort.descending("statDate"), useruuid).page(0, limit).list();
    }

    public long deleteByUser(String useruuid) {
        return delete("useruuid", useruuid);
    }
}
