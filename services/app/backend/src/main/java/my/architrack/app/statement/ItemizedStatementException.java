package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base of every failure the itemized statement flow reports to callers.
 */
public abstract class ItemizedStatementException extends RuntimeException {
	private final HttpStatus status;
	private final String code;

	protected ItemizedStatementException(HttpStatus status, String code, String message) {
		super(message);
		this.status = status;
		this.code = code;
	}

	protected ItemizedStatementException(HttpStatus status, String code, String message, Throwable cause) {
		super(message, cause);
		this.status = status;
		this.code = code;
	}

	public HttpStatus getStatus() {
		return status;
	}

	public String getCode() {
		return code;
	}

	public String getTitle() {
		return status.getReasonPhrase();
	}

	public Map<String, Object> getProperties() {
		return Map.of();
	}
}
