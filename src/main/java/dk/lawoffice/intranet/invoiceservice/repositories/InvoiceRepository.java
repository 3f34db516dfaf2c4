package dk.lawoffice.intranet.invoiceservice.repositories;

import dk.lawoffice.intranet.invoiceservice.model.Invoice;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.TypedQuery;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Panache repository for invoices, scoped to the user who created them.
 */
@ApplicationScoped
public class InvoiceRepository implements PanacheRepositoryBase<Invoice, String> {

    public static final Sort DEFAULT_SORT = Sort.descending("issueDate").and("createdAt", Sort.Direction.Descending);

    public Optional<Invoice> findOwned(String uuid, String useruuid) {
        return find("uuid = ?1 AND createdBy = ?2", uuid, useruuid).firstResultOptional();
    }

    public PanacheQuery<Invoice> search(String useruuid, InvoiceStatus status, String clientuuid) {
        StringBuilder query = new StringBuilder("createdBy = :user");
        Parameters params = Parameters.with("user", useruuid);
        if (status != null) {
            query.append(" AND status = :status");
            params.and("status", status);
        }
        if (clientuuid != null && !clientuuid.isBlank()) {
            query.append(" AND clientuuid = :client");
            params.and("client", clientuuid);
        }
        return find(query.toString(), DEFAULT_SORT, params);
    }

    public boolean invoiceNumberTaken(String invoiceNumber, String excludeUuid) {
        if (excludeUuid == null) {
            return count("invoiceNumber", invoiceNumber) > 0;
        }
        return count("invoiceNumber = ?1 AND uuid != ?2", invoiceNumber, excludeUuid) > 0;
    }

    /**
     * Sum of the totals of the user's paid invoices, optionally limited to a paid-at window.
     */
    public BigDecimal sumPaid(String useruuid, LocalDateTime paidFrom, LocalDateTime paidTo) {
        StringBuilder query = new StringBuilder("SELECT SUM(i.total) FROM Invoice i WHERE i.createdBy = :user AND i.status = :paid");
        if (paidFrom != null) query.append(" AND i.paidAt >= :from");
        if (paidTo != null) query.append(" AND i.paidAt < :to");
        TypedQuery<BigDecimal> typed = getEntityManager().createQuery(query.toString(), BigDecimal.class)
                .setParameter("user", useruuid)
                .setParameter("paid", InvoiceStatus.PAID);
        if (paidFrom != null) typed.setParameter("from", paidFrom);
        if (paidTo != null) typed.setParameter("to", paidTo);
        BigDecimal result = typed.getSingleResult();
        return result != null ? result : BigDecimal.ZERO;
    }

    public List<Invoice> findByClient(String clientuuid) {
        return list("clientuuid", clientuuid);
    }

    public int detachCase(String caseuuid) {
        return update("caseuuid = null WHERE caseuuid = ?1", caseuuid);
    }

    public int detachCreator(String useruuid) {
        return update("createdBy = null WHERE createdBy = ?1", useruuid);
    }
}
