package dk.lawoffice.intranet.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum ActivityType {

    CLIENT_CREATED("client_created", "Client Created"),
    CLIENT_UPDATED("client_updated", "Client Updated"),
    CLIENT_DELETED("client_deleted", "Client Deleted"),
    APPOINTMENT_CREATED("appointment_created", "Appointment Created"),
    APPOINTMENT_UPDATED("appointment_updated", "Appointment Updated"),
    APPOINTMENT_COMPLETED("appointment_completed", "Appointment Completed"),
    APPOINTMENT_CANCELLED("appointment_cancelled", "Appointment Cancelled"),
    CASE_CREATED("case_created", "Case Created"),
    CASE_UPDATED("case_updated", "Case Updated"),
    CASE_CLOSED("case_closed", "Case Closed"),
    INVOICE_CREATED("invoice_created", "Invoice Created"),
    INVOICE_SENT("invoice_sent", "Invoice Sent"),
    INVOICE_PAID("invoice_paid", "Invoice Paid");

    private final String value;
    private final String label;

    ActivityType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActivityType fromValue(String value) {
        if (value == null) return null;
        for (ActivityType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown activity type: " + value);
    }
}
