package my.architrack.app.export;

import my.architrack.app.statement.StatementColumn;
import my.architrack.app.statement.StatementRow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Tab-separated text for pasting into a spreadsheet: header line first, lines joined with
 * {@code \n}, quantities with exactly two decimals.
 */
public class ClipboardTextFormatter {
	private static final Pattern SEPARATORS = Pattern.compile("[\t\r\n]+");

	public String format(List<StatementRow> rows) {
		List<String> lines = new ArrayList<>(rows.size() + 1);
		List<String> header = new ArrayList<>();
		for (StatementColumn column : StatementColumn.values()) {
			header.add(column.label());
		}
		lines.add(String.join("\t", header));
		for (StatementRow row : rows) {
			List<String> cells = new ArrayList<>();
			for (StatementColumn column : StatementColumn.values()) {
				cells.add(cell(column, row));
			}
			lines.add(String.join("\t", cells));
		}
		return String.join("\n", lines);
	}

	private String cell(StatementColumn column, StatementRow row) {
		if (!column.isText()) {
			return QuantityFormat.fixed(row.quantity());
		}
		return SEPARATORS.matcher(column.text(row)).replaceAll(" ");
	}
}
