package my.architrack.app.statement;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Columns of a statement row, in export order.
 */
public enum StatementColumn {
	CUSTOM_CATEGORY("customCategory", "Category", StatementRow::customCategory),
	WORK_TYPE("workType", "Work Type", StatementRow::workType),
	NAME("name", "Name", StatementRow::name),
	SPECIFICATION("specification", "Specification", StatementRow::specification),
	QUANTITY("quantity", "Quantity", null),
	UNIT("unit", "Unit", StatementRow::unit);

	public static final List<StatementColumn> TEXT_COLUMNS = Arrays.stream(values())
			.filter(StatementColumn::isText)
			.toList();

	private final String key;
	private final String label;
	private final Function<StatementRow, String> text;

	StatementColumn(String key, String label, Function<StatementRow, String> text) {
		this.key = key;
		this.label = label;
		this.text = text;
	}

	public String key() {
		return key;
	}

	public String label() {
		return label;
	}

	public boolean isText() {
		return text != null;
	}

	public String text(StatementRow row) {
		if (text == null) {
			throw new IllegalStateException(name() + " is not a text column");
		}
		return text.apply(row);
	}

	public Comparator<StatementRow> ascending() {
		if (text == null) {
			return Comparator.comparing(StatementRow::quantity);
		}
		return (a, b) -> TextOrder.compare(text.apply(a), text.apply(b));
	}

	public static Optional<StatementColumn> fromKey(String key) {
		if (key == null) {
			return Optional.empty();
		}
		return Arrays.stream(values())
				.filter(column -> column.key.equals(key.trim()))
				.findFirst();
	}
}
