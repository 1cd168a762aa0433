package my.architrack.app.statement;

/**
 * Immutable query state for a statement's rows.
 */
public record StatementQuery(RowFilter filter, SortState sort, int page, int pageSize) {
	public static final int DEFAULT_PAGE_SIZE = 50;

	public StatementQuery {
		filter = filter == null ? RowFilter.NONE : filter;
		sort = sort == null ? SortState.NONE : sort;
		if (page < 1) {
			throw new StatementValidationException("page must be >= 1");
		}
		if (pageSize < 1) {
			throw new StatementValidationException("pageSize must be >= 1");
		}
	}

	public static StatementQuery firstPage() {
		return new StatementQuery(RowFilter.NONE, SortState.NONE, 1, DEFAULT_PAGE_SIZE);
	}

	public StatementQuery withPage(int newPage) {
		return new StatementQuery(filter, sort, newPage, pageSize);
	}

	public StatementQuery withFilter(RowFilter newFilter) {
		return new StatementQuery(newFilter, sort, 1, pageSize);
	}

	public StatementQuery withSort(SortState newSort) {
		return new StatementQuery(filter, newSort, page, pageSize);
	}
}
