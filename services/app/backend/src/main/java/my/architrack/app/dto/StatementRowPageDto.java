package my.architrack.app.dto;

import java.util.List;
import java.util.Map;

public record StatementRowPageDto(
		List<StatementRowDto> items,
		int totalCount,
		int totalPages,
		int currentPage,
		int pageSize,
		String sortColumn,
		String sortDirection,
		Map<String, String> filters
) {
}
