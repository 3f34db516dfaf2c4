package dk.lawoffice.intranet.invoiceservice.repositories;

import dk.lawoffice.intranet.invoiceservice.model.InvoiceItem;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class InvoiceItemRepository implements PanacheRepositoryBase<InvoiceItem, String> {

    public List<InvoiceItem> findByInvoice(String invoiceuuid) {
        return list("invoiceuuid", Sort.ascending("position"), invoiceuuid);
    }

    public long deleteByInvoice(String invoiceuuid) {
        return delete("invoiceuuid", invoiceuuid);
    }
}
