package dk.lawoffice.intranet.invoiceservice.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum InvoiceStatus {

    DRAFT("draft", "Draft"),
    SENT("sent", "Sent"),
    PAID("paid", "Paid"),
    OVERDUE("overdue", "Overdue"),
    CANCELLED("cancelled", "Cancelled");

    private final String value;
    private final String label;

    InvoiceStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InvoiceStatus fromValue(String value) {
        if (value == null) return null;
        for (InvoiceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("\"" + value + "\" is not a valid choice.");
    }
}
