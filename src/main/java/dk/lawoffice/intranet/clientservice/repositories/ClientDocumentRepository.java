package dk.lawoffice.intranet.clientservice.repositories;

import dk.lawoffice.intranet.clientservice.model.ClientDocument;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class ClientDocumentRepository implements PanacheRepositoryBase<ClientDocument, String> {

    public PanacheQuery<ClientDocument> findByClient(String clientuuid) {
        return find("clientuuid", Sort.descending("uploadedAt"), clientuuid);
    }

    public List<ClientDocument> listByClient(String clientuuid) {
        return findByClient(clientuuid).list();
    }

    public Optional<ClientDocument> findByClientAndUuid(String clientuuid, String uuid) {
        return find("clientuuid = ?1 AND uuid = ?2", clientuuid, uuid).firstResultOptional();
    }

    public int detachUploader(String useruuid) {
        return update("uploadedBy = null WHERE uploadedBy = ?1", useruuid);
    }
}
