package my.architrack.app.statement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Case-insensitive substring filters per text column, combined with AND.
 * Blank values are dropped and impose no constraint.
 */
public final class RowFilter {
	public static final RowFilter NONE = new RowFilter(new EnumMap<>(StatementColumn.class));

	private final Map<StatementColumn, String> needles;

	private RowFilter(EnumMap<StatementColumn, String> needles) {
		this.needles = Collections.unmodifiableMap(needles);
	}

	public static RowFilter of(Map<StatementColumn, String> values) {
		EnumMap<StatementColumn, String> needles = new EnumMap<>(StatementColumn.class);
		if (values != null) {
			values.forEach((column, value) -> {
				if (!column.isText()) {
					throw new StatementValidationException("Column " + column.key() + " cannot be filtered");
				}
				if (value != null && !value.isEmpty()) {
					needles.put(column, value);
				}
			});
		}
		return new RowFilter(needles);
	}

	public RowFilter with(StatementColumn column, String value) {
		EnumMap<StatementColumn, String> copy = new EnumMap<>(StatementColumn.class);
		copy.putAll(needles);
		copy.put(column, value);
		return of(copy);
	}

	public Map<StatementColumn, String> values() {
		return needles;
	}

	public boolean isEmpty() {
		return needles.isEmpty();
	}

	public boolean matches(StatementRow row) {
		for (Map.Entry<StatementColumn, String> entry : needles.entrySet()) {
			String cell = entry.getKey().text(row);
			if (cell.isEmpty()) {
				return false;
			}
			String needle = entry.getValue().toLowerCase(Locale.ROOT);
			if (!cell.toLowerCase(Locale.ROOT).contains(needle)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		RowFilter that = (RowFilter) o;
		return needles.equals(that.needles);
	}

	@Override
	public int hashCode() {
		return Objects.hash(needles);
	}

	@Override
	public String toString() {
		return "RowFilter" + needles;
	}
}
