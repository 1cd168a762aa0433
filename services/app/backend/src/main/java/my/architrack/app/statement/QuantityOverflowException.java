package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.Map;

public class QuantityOverflowException extends ItemizedStatementException {
	private final BigDecimal actualValue;
	private final BigDecimal minAllowed;
	private final BigDecimal maxAllowed;

	public QuantityOverflowException(BigDecimal actualValue, BigDecimal minAllowed, BigDecimal maxAllowed) {
		super(HttpStatus.valueOf(422), "QUANTITY_OVERFLOW",
				"Aggregated quantity " + actualValue.toPlainString() + " is outside ["
						+ minAllowed.toPlainString() + ", " + maxAllowed.toPlainString() + "]");
		this.actualValue = actualValue;
		this.minAllowed = minAllowed;
		this.maxAllowed = maxAllowed;
	}

	public BigDecimal getActualValue() {
		return actualValue;
	}

	public BigDecimal getMinAllowed() {
		return minAllowed;
	}

	public BigDecimal getMaxAllowed() {
		return maxAllowed;
	}

	@Override
	public String getTitle() {
		return "Quantity Overflow";
	}

	@Override
	public Map<String, Object> getProperties() {
		return Map.of(
				"actualValue", actualValue.toPlainString(),
				"minAllowed", minAllowed.toPlainString(),
				"maxAllowed", maxAllowed.toPlainString()
		);
	}
}
