package dk.lawoffice.intranet.invoiceservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Invoice with its line items. On update a non-null {@code items} list replaces the stored
 * items; a null list leaves them untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InvoiceDTO {

    private String uuid;

    @Size(max = 50, message = "Ensure this field has no more than 50 characters.")
    private String invoiceNumber;

    @NotBlank(message = "This field is required.")
    private String client;

    private String clientName;

    @JsonProperty("case")
    private String caseuuid;

    private String caseTitle;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private InvoiceStatus status;
    private String statusDisplay;
    private BigDecimal subtotal;
    private BigDecimal taxAmount;
    private BigDecimal total;
    private String notes;
    private String createdBy;
    private String createdByName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime paidAt;

    @Valid
    private List<InvoiceItemDTO> items;

}
