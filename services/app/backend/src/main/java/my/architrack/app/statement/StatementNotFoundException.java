package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class StatementNotFoundException extends ItemizedStatementException {
	private final Long statementId;

	public StatementNotFoundException(Long statementId) {
		super(HttpStatus.NOT_FOUND, "ITEMIZED_STATEMENT_NOT_FOUND", "Itemized statement not found: " + statementId);
		this.statementId = statementId;
	}

	public Long getStatementId() {
		return statementId;
	}

	@Override
	public String getTitle() {
		return "Itemized Statement Not Found";
	}

	@Override
	public Map<String, Object> getProperties() {
		return Map.of("itemizedStatementId", statementId);
	}
}
