package my.architrack.app.dto;

public record ItemizedStatementCreatedDto(
		ItemizedStatementDto statement,
		StatementRowPageDto items
) {
}
