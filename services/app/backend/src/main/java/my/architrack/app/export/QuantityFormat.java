package my.architrack.app.export;

import my.architrack.app.statement.QuantityAggregator;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class QuantityFormat {
	private QuantityFormat() {
	}

	static BigDecimal scaled(BigDecimal quantity) {
		BigDecimal value = quantity == null ? BigDecimal.ZERO : quantity;
		return value.setScale(QuantityAggregator.SCALE, RoundingMode.HALF_UP);
	}

	static String fixed(BigDecimal quantity) {
		return scaled(quantity).toPlainString();
	}
}
