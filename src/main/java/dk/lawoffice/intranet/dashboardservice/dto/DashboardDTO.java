package dk.lawoffice.intranet.dashboardservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Overview of the caller's practice, computed from the live tables on every request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DashboardDTO {

    private long totalClients;
    private long totalAppointments;
    private long upcomingAppointments;
    private long completedAppointments;
    private long cancelledAppointments;
    private long newClientsThisMonth;

    @Builder.Default
    private List<ClientDTO> recentClients = new ArrayList<>();

    @Builder.Default
    private List<AppointmentDTO> upcomingAppointmentsList = new ArrayList<>();

    @Builder.Default
    private List<RecentActivityDTO> recentActivities = new ArrayList<>();

    private UserDTO userInfo;

}
