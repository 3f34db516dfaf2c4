package dk.lawoffice.intranet.invoiceservice.services;

import dk.lawoffice.intranet.invoiceservice.config.BillingConfig;
import dk.lawoffice.intranet.invoiceservice.model.Invoice;
import dk.lawoffice.intranet.invoiceservice.model.InvoiceItem;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Money arithmetic of invoices.
 * <ul>
 *     <li>item amount = quantity * unit price * (1 + tax rate / 100)</li>
 *     <li>subtotal = sum of quantity * unit price</li>
 *     <li>tax amount = sum of (item amount - item net)</li>
 *     <li>total = subtotal + tax amount</li>
 * </ul>
 * All results are rounded half-up to the configured scale.
 */
@ApplicationScoped
public class InvoiceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Inject
    BillingConfig billingConfig;

    public BigDecimal net(InvoiceItem item) {
        return scale(item.getQuantity().multiply(item.getUnitPrice()));
    }

    public BigDecimal amount(InvoiceItem item) {
        BigDecimal rate = item.getTaxRate() != null ? item.getTaxRate() : BigDecimal.ZERO;
        BigDecimal gross = item.getQuantity().multiply(item.getUnitPrice())
                .multiply(BigDecimal.ONE.add(rate.divide(HUNDRED, 6, RoundingMode.HALF_UP)));
        return scale(gross);
    }

    /**
     * Sets every item's amount and the invoice's subtotal, tax amount and total.
     */
    public void apply(Invoice invoice, List<InvoiceItem> items) {
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        for (InvoiceItem item : items) {
            BigDecimal net = net(item);
            BigDecimal amount = amount(item);
            item.setAmount(amount);
            subtotal = subtotal.add(net);
            tax = tax.add(amount.subtract(net));
        }
        invoice.setSubtotal(scale(subtotal));
        invoice.setTaxAmount(scale(tax));
        invoice.setTotal(scale(subtotal.add(tax)));
    }

    public BigDecimal scale(BigDecimal value) {
        return value.setScale(billingConfig.taxScale(), RoundingMode.HALF_UP);
    }
}
