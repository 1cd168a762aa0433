package my.architrack.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateItemizedStatementRequest(
		@NotBlank String name,
		@NotNull @Positive Long quantityTableId
) {
}
