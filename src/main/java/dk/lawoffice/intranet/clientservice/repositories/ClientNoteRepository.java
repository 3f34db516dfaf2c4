package dk.lawoffice.intranet.clientservice.repositories;

import dk.lawoffice.intranet.clientservice.model.ClientNote;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class ClientNoteRepository implements PanacheRepositoryBase<ClientNote, String> {

    public PanacheQuery<ClientNote> findByClient(String clientuuid) {
        return find("clientuuid", Sort.descending("createdAt"), clientuuid);
    }

    public List<ClientNote> findRecentByClient(String clientuuid, int limit) {
        return findByClient(clientuuid).page(0, limit).list();
    }

    public Optional<ClientNote> findByClientAndUuid(String clientuuid, String uuid) {
        return find("clientuuid = ?1 AND uuid = ?2", clientuuid, uuid).firstResultOptional();
    }

    public long countByClient(String clientuuid) {
        return count("clientuuid", clientuuid);
    }

    public long deleteByClient(String clientuuid) {
        return delete("clientuuid", clientuuid);
    }

    public int detachCreator(String useruuid) {
        return update("createdBy = null WHERE createdBy = ?1", useruuid);
    }
}
