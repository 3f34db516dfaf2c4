package dk.lawoffice.intranet.caseservice.repositories;

import dk.lawoffice.intranet.caseservice.model.CaseNote;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class CaseNoteRepository implements PanacheRepositoryBase<CaseNote, String> {

    public List<CaseNote> findByCase(String caseuuid) {
        return list("caseuuid", Sort.descending("createdAt"), caseuuid);
    }

    public long deleteByCase(String caseuuid) {
        return delete("caseuuid", caseuuid);
    }

    public int detachAuthor(String useruuid) {
        return update("author = null WHERE author = ?1", useruuid);
    }
}
