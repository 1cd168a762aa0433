package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

public class QuantityTableNotFoundException extends ItemizedStatementException {
	public QuantityTableNotFoundException(Long quantityTableId) {
		super(HttpStatus.NOT_FOUND, "QUANTITY_TABLE_NOT_FOUND", "Quantity table not found: " + quantityTableId);
	}

	@Override
	public String getTitle() {
		return "Quantity Table Not Found";
	}
}
