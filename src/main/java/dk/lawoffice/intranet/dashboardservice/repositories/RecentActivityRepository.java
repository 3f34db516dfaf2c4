package dk.lawoffice.intranet.dashboardservice.repositories;

import dk.lawoffice.intranet.dashboardservice.model.RecentActivity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class RecentActivityRepository implements PanacheRepositoryBase<RecentActivity, String> {

    public List<RecentActivity> findLatest(String useruuid, int limit) {
        return find("useruuid", Sort.descending("createdAt"), useruuid).page(0, limit).list();
    }

    public long deleteByUser(String useruuid) {
        return delete("useruuid", useruuid);
    }
}
