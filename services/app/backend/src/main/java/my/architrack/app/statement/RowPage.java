package my.architrack.app.statement;

import java.util.List;

public record RowPage(
		List<StatementRow> rows,
		int totalCount,
		int totalPages,
		int currentPage,
		int pageSize
) {
}
