package my.architrack.app.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter, sort and paginate statement rows. Input rows must already be in the default order.
 * <p>
 * Exports call {@link #filterAndSort} with the same state a page was produced with, so the
 * exported sequence and the paged sequence are the same rows in the same order.
 */
public class StatementQueryEngine {

	public List<StatementRow> filterAndSort(List<StatementRow> rows, RowFilter filter, SortState sort) {
		List<StatementRow> result = new ArrayList<>(rows.size());
		for (StatementRow row : rows) {
			if (filter.matches(row)) {
				result.add(row);
			}
		}
		if (sort.isActive()) {
			result.sort(sort.comparator());
		}
		return List.copyOf(result);
	}

	public RowPage query(List<StatementRow> rows, StatementQuery query) {
		List<StatementRow> matching = filterAndSort(rows, query.filter(), query.sort());
		int total = matching.size();
		int pageSize = query.pageSize();
		int totalPages = (total + pageSize - 1) / pageSize;
		long from = (long) (query.page() - 1) * pageSize;
		List<StatementRow> pageRows;
		if (from >= total) {
			pageRows = List.of();
		} else {
			int to = (int) Math.min(total, from + pageSize);
			pageRows = matching.subList((int) from, to);
		}
		return new RowPage(pageRows, total, totalPages, query.page(), pageSize);
	}
}
