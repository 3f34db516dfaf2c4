package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class BillingViewModel extends ViewModel {

    @Getter
    private final List<InvoiceDTO> invoices = new ArrayList<>();

    @Getter
    private long totalCount;

    @Getter
    @Setter
    private String filter;

    public BillingViewModel(ApiSession session, Navigator navigator) {
        super(session, navigator);
    }

    public boolean load(int page) {
        return guard(() -> session.call(api -> api.invoices(null, page, null))).map(response -> {
            invoices.clear();
            invoices.addAll(response.getResults());
            totalCount = response.getCount();
            return true;
        }).orElse(false);
    }

    public List<InvoiceDTO> visibleInvoices() {
        return invoices.stream()
                .filter(invoice -> matches(filter, invoice.getInvoiceNumber(), invoice.getClientName(), invoice.getStatusDisplay()))
                .collect(Collectors.toList());
    }

    /**
     * Sum of the totals of the loaded invoices that are neither paid nor cancelled.
     */
    public BigDecimal outstanding() {
        return invoices.stream()
                .filter(invoice -> invoice.getStatus() != InvoiceStatus.PAID && invoice.getStatus() != InvoiceStatus.CANCELLED)
                .map(InvoiceDTO::getTotal)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean create(InvoiceDTO invoice) {
        return guard(() -> session.call(api -> api.createInvoice(invoice))).map(created -> {
            invoices.add(0, created);
            totalCount++;
            info("Invoice " + created.getInvoiceNumber() + " created");
            return true;
        }).orElse(false);
    }

    public boolean markAsPaid(String uuid) {
        return guard(() -> session.call(api -> api.markInvoicePaid(uuid))).map(paid -> {
            invoices.replaceAll(invoice -> Objects.equals(invoice.getUuid(), uuid) ? paid : invoice);
            info("Invoice " + paid.getInvoiceNumber() + " marked as paid");
            return true;
        }).orElse(false);
    }

    public boolean sendToClient(String uuid) {
        return guard(() -> session.call(api -> api.sendInvoice(uuid))).map(response -> {
            invoices.stream()
                    .filter(invoice -> Objects.equals(invoice.getUuid(), uuid) && invoice.getStatus() == InvoiceStatus.DRAFT)
                    .forEach(invoice -> {
                        invoice.setStatus(InvoiceStatus.SENT);
                        invoice.setStatusDisplay(InvoiceStatus.SENT.getLabel());
                    });
            info(response.getStatus());
            return true;
        }).orElse(false);
    }

    public boolean delete(String uuid) {
        boolean deleted = guardRun(() -> session.run(api -> api.deleteInvoice(uuid)));
        if (deleted && invoices.removeIf(invoice -> Objects.equals(invoice.getUuid(), uuid))) {
            totalCount--;
        }
        return deleted;
    }
}
