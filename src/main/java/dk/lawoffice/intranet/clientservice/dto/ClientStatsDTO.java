package dk.lawoffice.intranet.clientservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClientStatsDTO {

    private long totalClients;
    private long activeClients;
    private long inactiveClients;
    private long newClientsThisMonth;
    @Builder.Default
    private List<CityCount> topCities = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CityCount {
        private String city;
        private long count;
    }
}
