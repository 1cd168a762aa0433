package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

public class ProjectNotFoundException extends ItemizedStatementException {
	public ProjectNotFoundException(Long projectId) {
		super(HttpStatus.NOT_FOUND, "PROJECT_NOT_FOUND", "Project not found: " + projectId);
	}

	@Override
	public String getTitle() {
		return "Project Not Found";
	}
}
