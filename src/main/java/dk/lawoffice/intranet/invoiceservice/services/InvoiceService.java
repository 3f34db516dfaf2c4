package dk.lawoffice.intranet.invoiceservice.services;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.caseservice.model.LegalCase;
import dk.lawoffice.intranet.caseservice.repositories.CaseRepository;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.events.ActivityEvent;
import dk.lawoffice.intranet.events.ActivityType;
import dk.lawoffice.intranet.events.CaseDeletedEvent;
import dk.lawoffice.intranet.events.ClientDeletedEvent;
import dk.lawoffice.intranet.events.UserDeletedEvent;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.invoiceservice.config.BillingConfig;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceItemDTO;
import dk.lawoffice.intranet.invoiceservice.model.Invoice;
import dk.lawoffice.intranet.invoiceservice.model.InvoiceItem;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import dk.lawoffice.intranet.invoiceservice.repositories.InvoiceItemRepository;
import dk.lawoffice.intranet.invoiceservice.repositories.InvoiceRepository;
import dk.lawoffice.intranet.userservice.services.UserDirectory;
import dk.lawoffice.intranet.utils.JsonPatcher;
import dk.lawoffice.intranet.utils.RequestValidator;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

@JBossLog
@ApplicationScoped
public class InvoiceService {

    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    @Inject
    InvoiceRepository invoiceRepository;

    @Inject
    InvoiceItemRepository itemRepository;

    @Inject
    ClientRepository clientRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    InvoiceCalculator calculator;

    @Inject
    BillingConfig billingConfig;

    @Inject
    UserDirectory userDirectory;

    @Inject
    RequestValidator validator;

    @Inject
    JsonPatcher patcher;

    @Inject
    Event<ActivityEvent> activityEvent;

    public PanacheQuery<Invoice> list(String useruuid, InvoiceStatus status, String clientuuid) {
        return invoiceRepository.search(useruuid, status, clientuuid);
    }

    public Invoice findOwned(String useruuid, String uuid) {
        return invoiceRepository.findOwned(uuid, useruuid)
                .orElseThrow(() -> new WebApplicationException("Invoice not found: " + uuid, Response.Status.NOT_FOUND));
    }

    public List<InvoiceItem> items(Invoice invoice) {
        return itemRepository.findByInvoice(invoice.getUuid());
    }

    /**
     * Creates the invoice and one item row per entry of {@code items}.
     */
    @Transactional
    public Invoice create(String useruuid, InvoiceDTO dto) {
        validator.validate(dto);
        Invoice invoice = new Invoice();
        invoice.setUuid(UUID.randomUUID().toString());
        invoice.setCreatedBy(useruuid);
        invoice.setInvoiceNumber(resolveInvoiceNumber(dto.getInvoiceNumber(), null));
        applyHeader(useruuid, invoice, dto);
        invoice.setStatus(dto.getStatus() != null ? dto.getStatus() : InvoiceStatus.DRAFT);
        if (invoice.getStatus() == InvoiceStatus.PAID) invoice.setPaidAt(LocalDateTime.now());
        List<InvoiceItem> items = buildItems(invoice, dto.getItems());
        applyTotals(invoice, items, dto);
        invoiceRepository.persist(invoice);
        itemRepository.persist(items);
        log.infof("Created invoice: uuid=%s, number=%s, items=%d, total=%s",
                invoice.getUuid(), invoice.getInvoiceNumber(), items.size(), invoice.getTotal());
        activityEvent.fire(new ActivityEvent(useruuid, ActivityType.INVOICE_CREATED,
                "Invoice " + invoice.getInvoiceNumber() + " created", invoice.getUuid()));
        return invoice;
    }

    @Transactional
    public Invoice update(String useruuid, String uuid, InvoiceDTO dto) {
        Invoice invoice = findOwned(useruuid, uuid);
        validator.validate(dto);
        if (dto.getInvoiceNumber() != null && !dto.getInvoiceNumber().isBlank()) {
            invoice.setInvoiceNumber(resolveInvoiceNumber(dto.getInvoiceNumber(), uuid));
        }
        applyHeader(useruuid, invoice, dto);
        if (dto.getStatus() != null && dto.getStatus() != invoice.getStatus()) {
            invoice.setStatus(dto.getStatus());
            invoice.setPaidAt(dto.getStatus() == InvoiceStatus.PAID ? LocalDateTime.now() : null);
        }
        List<InvoiceItem> items;
        if (dto.getItems() != null) {
            itemRepository.deleteByInvoice(uuid);
            items = buildItems(invoice, dto.getItems());
            itemRepository.persist(items);
        } else {
            items = itemRepository.findByInvoice(uuid);
        }
        applyTotals(invoice, items, dto);
        log.infof("Updated invoice: uuid=%s, total=%s", uuid, invoice.getTotal());
        return invoice;
    }

    @Transactional
    public Invoice patch(String useruuid, String uuid, JsonNode patch) {
        Invoice invoice = findOwned(useruuid, uuid);
        InvoiceDTO current = toDTO(invoice, false);
        current.setSubtotal(null);
        current.setTaxAmount(null);
        current.setTotal(null);
        return update(useruuid, uuid, patcher.merge(current, patch));
    }

    @Transactional
    public void delete(String useruuid, String uuid) {
        Invoice invoice = findOwned(useruuid, uuid);
        itemRepository.deleteByInvoice(uuid);
        invoiceRepository.delete(invoice);
        log.infof("Deleted invoice: %s", uuid);
    }

    @Transactional
    public Invoice markAsPaid(String useruuid, String uuid) {
        Invoice invoice = findOwned(useruuid, uuid);
        invoice.setStatus(InvoiceStatus.PAID);
        invoice.setPaidAt(LocalDateTime.now());
        log.infof("Invoice %s marked as paid", invoice.getInvoiceNumber());
        activityEvent.fire(new ActivityEvent(useruuid, ActivityType.INVOICE_PAID,
                "Invoice " + invoice.getInvoiceNumber() + " paid", uuid));
        return invoice;
    }

    /**
     * Marks a draft invoice as sent. Invoices in any other status keep their status.
     */
    @Transactional
    public Invoice sendToClient(String useruuid, String uuid) {
        Invoice invoice = findOwned(useruuid, uuid);
        if (invoice.getStatus() == InvoiceStatus.DRAFT) {
            invoice.setStatus(InvoiceStatus.SENT);
        }
        log.infof("Invoice %s sent to client %s", invoice.getInvoiceNumber(), invoice.getClientuuid());
        activityEvent.fire(new ActivityEvent(useruuid, ActivityType.INVOICE_SENT,
                "Invoice " + invoice.getInvoiceNumber() + " sent to client", uuid));
        return invoice;
    }

    public BigDecimal totalRevenue(String useruuid) {
        return invoiceRepository.sumPaid(useruuid, null, null);
    }

    public BigDecimal revenueBetween(String useruuid, LocalDateTime from, LocalDateTime to) {
        return invoiceRepository.sumPaid(useruuid, from, to);
    }

    private void applyHeader(String useruuid, Invoice invoice, InvoiceDTO dto) {
        Client client = clientRepository.findOwned(dto.getClient(), useruuid)
                .orElseThrow(() -> ValidationException.of("client", "Invalid pk \"" + dto.getClient() + "\" - object does not exist."));
        invoice.setClientuuid(client.getUuid());
        if (dto.getCaseuuid() != null && !dto.getCaseuuid().isBlank()) {
            LegalCase legalCase = caseRepository.findVisible(dto.getCaseuuid(), useruuid)
                    .orElseThrow(() -> ValidationException.of("case", "Invalid pk \"" + dto.getCaseuuid() + "\" - object does not exist."));
            if (!legalCase.getClientuuid().equals(client.getUuid())) {
                throw ValidationException.of("case", "Case does not belong to the selected client.");
            }
            invoice.setCaseuuid(legalCase.getUuid());
        } else {
            invoice.setCaseuuid(null);
        }
        LocalDate issueDate = dto.getIssueDate() != null ? dto.getIssueDate()
                : invoice.getIssueDate() != null ? invoice.getIssueDate() : LocalDate.now();
        LocalDate dueDate = dto.getDueDate() != null ? dto.getDueDate()
                : invoice.getDueDate() != null ? invoice.getDueDate() : issueDate.plusDays(billingConfig.defaultPaymentTermDays());
        if (dueDate.isBefore(issueDate)) {
            throw ValidationException.of("due_date", "Due date must be on or after the issue date.");
        }
        invoice.setIssueDate(issueDate);
        invoice.setDueDate(dueDate);
        invoice.setNotes(dto.getNotes());
    }

    private List<InvoiceItem> buildItems(Invoice invoice, List<InvoiceItemDTO> itemDTOs) {
        List<InvoiceItem> items = new ArrayList<>();
        if (itemDTOs == null) return items;
        int position = 0;
        for (InvoiceItemDTO dto : itemDTOs) {
            InvoiceItem item = new InvoiceItem(invoice.getUuid(), dto.getDescription().trim(), dto.getQuantity(), dto.getUnitPrice(),
                    dto.getTaxRate() != null ? dto.getTaxRate() : BigDecimal.ZERO, position++);
            item.setAmount(dto.getAmount() != null ? dto.getAmount() : calculator.amount(item));
            items.add(item);
        }
        return items;
    }

    private void applyTotals(Invoice invoice, List<InvoiceItem> items, InvoiceDTO dto) {
        if (billingConfig.computeTotals()) {
            calculator.apply(invoice, items);
            if (dto.getTotal() != null && dto.getTotal().compareTo(invoice.getTotal()) != 0) {
                log.warnf("Invoice %s: ignoring client-supplied total %s, computed %s",
                        invoice.getInvoiceNumber(), dto.getTotal(), invoice.getTotal());
            }
            return;
        }
        if (dto.getSubtotal() != null) invoice.setSubtotal(dto.getSubtotal());
        if (dto.getTaxAmount() != null) invoice.setTaxAmount(dto.getTaxAmount());
        invoice.setTotal(dto.getTotal() != null ? dto.getTotal() : invoice.getSubtotal().add(invoice.getTaxAmount()));
    }

    private String resolveInvoiceNumber(String requested, String excludeUuid) {
        if (requested != null && !requested.isBlank()) {
            String number = requested.trim();
            if (invoiceRepository.invoiceNumberTaken(number, excludeUuid)) {
                throw ValidationException.of("invoice_number", "invoice with this invoice number already exists.");
            }
            return number;
        }
        String number;
        do {
            number = "INV-" + LocalDate.now().format(NUMBER_DATE) + "-"
                    + UUID.randomUUID().toString().substring(0, 6).toUpperCase(Locale.ROOT);
        } while (invoiceRepository.invoiceNumberTaken(number, null));
        return number;
    }

    public InvoiceDTO toDTO(Invoice invoice) {
        return toDTO(invoice, true);
    }

    InvoiceDTO toDTO(Invoice invoice, boolean withItems) {
        Client client = clientRepository.findById(invoice.getClientuuid());
        LegalCase legalCase = invoice.getCaseuuid() != null ? caseRepository.findById(invoice.getCaseuuid()) : null;
        return InvoiceDTO.builder()
                .uuid(invoice.getUuid())
                .invoiceNumber(invoice.getInvoiceNumber())
                .client(invoice.getClientuuid())
                .clientName(client != null ? client.getFullName() : null)
                .caseuuid(invoice.getCaseuuid())
                .caseTitle(legalCase != null ? legalCase.getTitle() : null)
                .issueDate(invoice.getIssueDate())
                .dueDate(invoice.getDueDate())
                .status(invoice.getStatus())
                .statusDisplay(invoice.getStatus().getLabel())
                .subtotal(invoice.getSubtotal())
                .taxAmount(invoice.getTaxAmount())
                .total(invoice.getTotal())
                .notes(invoice.getNotes())
                .createdBy(invoice.getCreatedBy())
                .createdByName(userDirectory.fullName(invoice.getCreatedBy()))
                .createdAt(invoice.getCreatedAt())
                .updatedAt(invoice.getUpdatedAt())
                .paidAt(invoice.getPaidAt())
                .items(withItems ? itemRepository.findByInvoice(invoice.getUuid()).stream().map(InvoiceService::toItemDTO).collect(Collectors.toList()) : null)
                .build();
    }

    static InvoiceItemDTO toItemDTO(InvoiceItem item) {
        return InvoiceItemDTO.builder()
                .uuid(item.getUuid())
                .description(item.getDescription())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .taxRate(item.getTaxRate())
                .amount(item.getAmount())
                .build();
    }

    void onClientDeleted(@Observes ClientDeletedEvent event) {
        List<Invoice> invoices = invoiceRepository.findByClient(event.clientuuid());
        invoices.forEach(invoice -> {
            itemRepository.deleteByInvoice(invoice.getUuid());
            invoiceRepository.delete(invoice);
        });
        log.debugf("Removed %d invoices of deleted client %s", invoices.size(), event.clientuuid());
    }

    void onCaseDeleted(@Observes CaseDeletedEvent event) {
        invoiceRepository.detachCase(event.caseuuid());
    }

    void onUserDeleted(@Observes UserDeletedEvent event) {
        invoiceRepository.detachCreator(event.useruuid());
    }
}
