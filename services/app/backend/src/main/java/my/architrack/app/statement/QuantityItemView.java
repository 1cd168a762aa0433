package my.architrack.app.statement;

import java.math.BigDecimal;

public record QuantityItemView(
		Long id,
		String customCategory,
		String workType,
		String name,
		String specification,
		String unit,
		BigDecimal quantity
) {
}
