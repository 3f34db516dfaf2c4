package dk.lawoffice.intranet.appointmentservice.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

@Getter
public enum AppointmentStatus {

    SCHEDULED("scheduled", "Scheduled"),
    CONFIRMED("confirmed", "Confirmed"),
    CANCELLED("cancelled", "Cancelled"),
    COMPLETED("completed", "Completed");

    /** Statuses of appointments that are still going to happen. */
    public static final Set<AppointmentStatus> PENDING = EnumSet.of(SCHEDULED, CONFIRMED);

    private final String value;
    private final String label;

    AppointmentStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AppointmentStatus fromValue(String value) {
        if (value == null) return null;
        for (AppointmentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("\"" + value + "\" is not a valid choice.");
    }
}
