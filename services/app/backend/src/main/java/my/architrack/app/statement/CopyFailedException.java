package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

public class CopyFailedException extends ItemizedStatementException {
	public CopyFailedException(String message, Throwable cause) {
		super(HttpStatus.INTERNAL_SERVER_ERROR, "COPY_FAILED", message, cause);
	}

	@Override
	public String getTitle() {
		return "Copy Failed";
	}
}
