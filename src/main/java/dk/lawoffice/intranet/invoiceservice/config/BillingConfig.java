package dk.lawoffice.intranet.invoiceservice.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Billing settings under {@code lawoffice.billing}.
 */
@ConfigMapping(prefix = "lawoffice.billing")
public interface BillingConfig {

    /**
     * When true the server derives item amounts and invoice totals from the line items and
     * ignores the values sent by the caller. When false the caller's values are stored as sent.
     */
    @WithDefault("true")
    boolean computeTotals();

    /**
     * Decimal places money amounts are rounded to.
     */
    @WithDefault("2")
    int taxScale();

    /**
     * Days between issue date and due date when the caller omits the due date.
     */
    @WithDefault("30")
    int defaultPaymentTermDays();
}
