package my.architrack.app.statement;

import java.util.Comparator;
import java.util.Objects;

/**
 * At most one active sort column. {@link #NONE} means the default row order.
 */
public record SortState(StatementColumn column, SortDirection direction) {
	public static final SortState NONE = new SortState(null, SortDirection.ASC);

	public SortState {
		direction = direction == null ? SortDirection.ASC : direction;
	}

	public static SortState by(StatementColumn column, SortDirection direction) {
		return new SortState(Objects.requireNonNull(column, "column"), direction);
	}

	public boolean isActive() {
		return column != null;
	}

	/**
	 * Result of clicking a column header: a new column sorts ascending, the active column flips.
	 */
	public SortState toggle(StatementColumn clicked) {
		Objects.requireNonNull(clicked, "clicked");
		if (clicked == column) {
			return new SortState(column, direction.flip());
		}
		return new SortState(clicked, SortDirection.ASC);
	}

	Comparator<StatementRow> comparator() {
		Comparator<StatementRow> ascending = column.ascending();
		return direction == SortDirection.DESC ? ascending.reversed() : ascending;
	}
}
