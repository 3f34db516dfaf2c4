package dk.lawoffice.intranet.caseservice.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum CaseStatus {

    OPEN("open", "Open"),
    IN_PROGRESS("in_progress", "In Progress"),
    PENDING("pending", "Pending"),
    CLOSED("closed", "Closed");

    private final String value;
    private final String label;

    CaseStatus(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CaseStatus fromValue(String value) {
        if (value == null) return null;
        for (CaseStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("\"" + value + "\" is not a valid choice.");
    }
}
