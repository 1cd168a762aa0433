package my.architrack.app.dto;

public record ItemizedStatementDetailDto(
		ItemizedStatementDto statement,
		ProjectSummaryDto project
) {
}
