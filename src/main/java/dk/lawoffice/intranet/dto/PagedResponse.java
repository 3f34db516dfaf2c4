package dk.lawoffice.intranet.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope returned by every list endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated response containing one page of results and links to its neighbours")
public class PagedResponse<T> {

    @Schema(description = "Total number of rows across all pages", example = "42", required = true)
    private long count;

    @Schema(description = "Absolute URL of the next page, null on the last page")
    private String next;

    @Schema(description = "Absolute URL of the previous page, null on the first page")
    private String previous;

    @Builder.Default
    @Schema(description = "Rows of the current page", required = true)
    private List<T> results = new ArrayList<>();

}
