package my.architrack.app.dto;

import java.math.BigDecimal;

public record StatementRowDto(
		String customCategory,
		String workType,
		String name,
		String specification,
		String unit,
		BigDecimal quantity
) {
}
