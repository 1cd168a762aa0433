package my.architrack.app.service;

import my.architrack.app.export.ExportFormat;
import my.architrack.app.statement.RowFilter;
import my.architrack.app.statement.SortDirection;
import my.architrack.app.statement.SortState;
import my.architrack.app.statement.StatementColumn;
import my.architrack.app.statement.StatementQuery;
import my.architrack.app.statement.StatementValidationException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns raw request parameters into a {@link StatementQuery}.
 */
@Component
public class StatementQueryParser {

	public StatementQuery parse(Map<String, String> params, Integer page, int pageSize) {
		int resolvedPage = page == null ? 1 : page;
		if (resolvedPage < 1) {
			throw new StatementValidationException("page must be >= 1");
		}
		return new StatementQuery(parseFilter(params), parseSort(params), resolvedPage, pageSize);
	}

	public RowFilter parseFilter(Map<String, String> params) {
		Map<StatementColumn, String> values = new EnumMap<>(StatementColumn.class);
		if (params != null) {
			for (StatementColumn column : StatementColumn.TEXT_COLUMNS) {
				String value = params.get(column.key());
				if (value != null) {
					values.put(column, value);
				}
			}
		}
		return RowFilter.of(values);
	}

	public SortState parseSort(Map<String, String> params) {
		String sort = params == null ? null : params.get("sort");
		String order = params == null ? null : params.get("order");
		if (sort == null || sort.isBlank()) {
			if (order != null && !order.isBlank()) {
				parseDirection(order);
			}
			return SortState.NONE;
		}
		StatementColumn column = StatementColumn.fromKey(sort)
				.orElseThrow(() -> new StatementValidationException("Unknown sort column: " + sort));
		SortDirection direction = order == null || order.isBlank() ? SortDirection.ASC : parseDirection(order);
		return SortState.by(column, direction);
	}

	public ExportFormat parseFormat(String format) {
		return ExportFormat.fromKey(format)
				.orElseThrow(() -> new StatementValidationException("Unknown export format: " + format));
	}

	private SortDirection parseDirection(String order) {
		return SortDirection.fromKey(order)
				.orElseThrow(() -> new StatementValidationException("Unknown sort order: " + order));
	}
}
