package my.architrack.app.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record DeleteItemizedStatementRequest(
		@NotNull @PositiveOrZero Long version
) {
}
