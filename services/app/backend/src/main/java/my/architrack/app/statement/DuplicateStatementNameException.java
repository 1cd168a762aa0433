package my.architrack.app.statement;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class DuplicateStatementNameException extends ItemizedStatementException {
	private final String duplicateName;
	private final Long projectId;

	public DuplicateStatementNameException(String duplicateName, Long projectId) {
		super(HttpStatus.CONFLICT, "DUPLICATE_ITEMIZED_STATEMENT_NAME",
				"An itemized statement named '" + duplicateName + "' already exists in project " + projectId);
		this.duplicateName = duplicateName;
		this.projectId = projectId;
	}

	public DuplicateStatementNameException(String duplicateName, Long projectId, Throwable cause) {
		super(HttpStatus.CONFLICT, "DUPLICATE_ITEMIZED_STATEMENT_NAME",
				"An itemized statement named '" + duplicateName + "' already exists in project " + projectId, cause);
		this.duplicateName = duplicateName;
		this.projectId = projectId;
	}

	public String getDuplicateName() {
		return duplicateName;
	}

	public Long getProjectId() {
		return projectId;
	}

	@Override
	public String getTitle() {
		return "Duplicate Name";
	}

	@Override
	public Map<String, Object> getProperties() {
		return Map.of("name", duplicateName, "projectId", projectId);
	}
}
