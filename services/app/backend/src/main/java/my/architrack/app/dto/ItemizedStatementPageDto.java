package my.architrack.app.dto;

import java.util.List;

public record ItemizedStatementPageDto(
		List<ItemizedStatementDto> data,
		int page,
		int limit,
		long total,
		int totalPages
) {
}
