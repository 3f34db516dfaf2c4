package dk.lawoffice.intranet.clientservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotesSummaryDTO {

    private String client;
    private String clientName;
    private long totalNotes;
    private LocalDateTime latestNoteAt;
    @Builder.Default
    private List<ClientNoteDTO> recentNotes = new ArrayList<>();

}
