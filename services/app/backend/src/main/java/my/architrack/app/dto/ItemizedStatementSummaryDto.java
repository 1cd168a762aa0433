package my.architrack.app.dto;

import java.util.List;

public record ItemizedStatementSummaryDto(
		long totalCount,
		List<ItemizedStatementDto> latestStatements
) {
}
