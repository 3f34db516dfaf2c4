package dk.lawoffice.intranet.invoiceservice.services;

import dk.lawoffice.intranet.invoiceservice.config.BillingConfig;
import dk.lawoffice.intranet.invoiceservice.model.Invoice;
import dk.lawoffice.intranet.invoiceservice.model.InvoiceItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InvoiceCalculatorTest {

    private InvoiceCalculator calculator;

    @BeforeEach
    void setUp() {
        BillingConfig config = Mockito.mock(BillingConfig.class);
        Mockito.when(config.taxScale()).thenReturn(2);
        calculator = new InvoiceCalculator();
        calculator.billingConfig = config;
    }

    private static InvoiceItem item(String quantity, String unitPrice, String taxRate) {
        return new InvoiceItem("invoice", "Work", new BigDecimal(quantity), new BigDecimal(unitPrice),
                taxRate != null ? new BigDecimal(taxRate) : null, 0);
    }

    @Test
    void itemAmountIncludesTax() {
        assertEquals(new BigDecimal("375.00"), calculator.amount(item("2", "150", "25")));
        assertEquals(new BigDecimal("300.00"), calculator.net(item("2", "150", "25")));
        assertEquals(new BigDecimal("10.00"), calculator.amount(item("1", "10", null)));
    }

    @Test
    void invoiceTotalsAddUp() {
        Invoice invoice = new Invoice();
        List<InvoiceItem> items = List.of(item("2", "150.00", "25"), item("1", "99.99", "0"), item("1.5", "33.33", "8.25"));

        calculator.apply(invoice, items);

        // 1.5 * 33.33 = 49.995 -> 50.00 net; gross 54.119... -> 54.12
        assertEquals(new BigDecimal("54.12"), items.get(2).getAmount());
        assertEquals(new BigDecimal("449.99"), invoice.getSubtotal());
        assertEquals(new BigDecimal("79.12"), invoice.getTaxAmount());
        assertEquals(new BigDecimal("529.11"), invoice.getTotal());
    }

    @Test
    void emptyInvoiceIsZero() {
        Invoice invoice = new Invoice();

        calculator.apply(invoice, List.of());

        assertEquals(new BigDecimal("0.00"), invoice.getTotal());
    }
}
