package dk.lawoffice.intranet.dashboardservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DashboardStatsDTO {

    private String uuid;
    private String user;
    private LocalDate statDate;
    private long totalClients;
    private long totalAppointments;
    private long upcomingAppointments;
    private long completedAppointments;
    private long cancelledAppointments;
    private long newClientsThisMonth;
    private BigDecimal revenueThisMonth;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

}
