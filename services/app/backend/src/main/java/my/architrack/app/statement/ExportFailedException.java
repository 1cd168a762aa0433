package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

public class ExportFailedException extends ItemizedStatementException {
	public ExportFailedException(String message, Throwable cause) {
		super(HttpStatus.INTERNAL_SERVER_ERROR, "EXPORT_FAILED", message, cause);
	}

	@Override
	public String getTitle() {
		return "Export Failed";
	}
}
