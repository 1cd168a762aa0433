package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class EmptyQuantityItemsException extends ItemizedStatementException {
	private final Long quantityTableId;

	public EmptyQuantityItemsException(Long quantityTableId) {
		super(HttpStatus.BAD_REQUEST, "EMPTY_QUANTITY_ITEMS",
				"Quantity table " + quantityTableId + " has no items to aggregate");
		this.quantityTableId = quantityTableId;
	}

	public Long getQuantityTableId() {
		return quantityTableId;
	}

	@Override
	public String getTitle() {
		return "Empty Quantity Items";
	}

	@Override
	public Map<String, Object> getProperties() {
		return Map.of("quantityTableId", quantityTableId);
	}
}
