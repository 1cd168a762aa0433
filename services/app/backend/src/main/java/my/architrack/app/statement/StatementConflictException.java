package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The caller's version token is stale; it has to reload the statement before retrying.
 */
public class StatementConflictException extends ItemizedStatementException {
	private final long expectedVersion;
	private final Long actualVersion;

	public StatementConflictException(long expectedVersion, Long actualVersion) {
		super(HttpStatus.CONFLICT, "ITEMIZED_STATEMENT_CONFLICT",
				"The itemized statement was modified by another user. Reload and try again.");
		this.expectedVersion = expectedVersion;
		this.actualVersion = actualVersion;
	}

	public long getExpectedVersion() {
		return expectedVersion;
	}

	public Long getActualVersion() {
		return actualVersion;
	}

	@Override
	public String getTitle() {
		return "Conflict";
	}

	@Override
	public Map<String, Object> getProperties() {
		Map<String, Object> properties = new LinkedHashMap<>();
		properties.put("expectedVersion", expectedVersion);
		if (actualVersion != null) {
			properties.put("actualVersion", actualVersion);
		}
		return properties;
	}
}
