package dk.lawoffice.intranet.invoiceservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
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
public class InvoiceItemDTO {

    private String uuid;

    @NotBlank(message = "This field is required.")
    @Size(max = 500, message = "Ensure this field has no more than 500 characters.")
    private String description;

    @NotNull(message = "This field is required.")
    @DecimalMin(value = "0.01", message = "Ensure this value is greater than or equal to 0.01.")
    private BigDecimal quantity;

    @NotNull(message = "This field is required.")
    @DecimalMin(value = "0", message = "Ensure this value is greater than or equal to 0.")
    private BigDecimal unitPrice;

    @DecimalMin(value = "0", message = "Ensure this value is greater than or equal to 0.")
    @DecimalMax(value = "100", message = "Ensure this value is less than or equal to 100.")
    private BigDecimal taxRate;

    private BigDecimal amount;

}
