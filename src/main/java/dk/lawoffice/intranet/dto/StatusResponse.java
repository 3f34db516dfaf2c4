package dk.lawoffice.intranet.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement body of the action endpoints, e.g. {@code {"status": "appointment confirmed"}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private String status;

}
