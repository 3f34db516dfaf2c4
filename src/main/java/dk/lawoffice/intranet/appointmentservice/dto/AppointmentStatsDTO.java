package dk.lawoffice.intranet.appointmentservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AppointmentStatsDTO {

    private long total;
    private long today;
    /** Scheduled or confirmed appointments starting within the next seven days. */
    private long upcoming;
    private long completed;
    private long activeClients;
    private BigDecimal totalRevenue;

}
