package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

public class StatementValidationException extends ItemizedStatementException {
	public StatementValidationException(String message) {
		super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
	}
}
