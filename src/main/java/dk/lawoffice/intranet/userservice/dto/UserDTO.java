package dk.lawoffice.intranet.userservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.userservice.model.User;
import dk.lawoffice.intranet.userservice.model.enums.UserType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserDTO {

    private String uuid;
    private String email;
    private String firstName;
    private String lastName;
    private String fullName;
    private UserType userType;
    private String userTypeDisplay;
    private String phone;
    private String address;
    private LocalDate dateOfBirth;
    @JsonProperty("is_active")
    private boolean active;
    private LocalDateTime dateJoined;
    private LocalDateTime lastLogin;

    public static UserDTO from(User user) {
        return UserDTO.builder()
                .uuid(user.getUuid())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .fullName(user.getFullName())
                .userType(user.getUserType())
                .userTypeDisplay(user.getUserType() != null ? user.getUserType().getLabel() : null)
                .phone(user.getPhone())
                .address(user.getAddress())
                .dateOfBirth(user.getDateOfBirth())
                .active(user.isActive())
                .dateJoined(user.getDateJoined())
                .lastLogin(user.getLastLogin())
                .build();
    }
}
