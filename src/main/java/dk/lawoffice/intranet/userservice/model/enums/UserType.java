package dk.lawoffice.intranet.userservice.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum UserType {

    ADMIN("admin", "Administrator"),
    LAWYER("lawyer", "Lawyer"),
    PARALEGAL("paralegal", "Paralegal");

    private final String value;
    private final String label;

    UserType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UserType fromValue(String value) {
        if (value == null) return null;
        for (UserType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown user type: " + value);
    }
}
