package my.architrack.app.service;

import my.architrack.app.domain.ItemizedStatement;
import my.architrack.app.export.ClipboardTextFormatter;
import my.architrack.app.export.ExportedFile;
import my.architrack.app.export.SpreadsheetExporter;
import my.architrack.app.statement.CopyFailedException;
import my.architrack.app.statement.ExportFailedException;
import my.architrack.app.statement.RowFilter;
import my.architrack.app.statement.SortState;
import my.architrack.app.statement.StatementQueryEngine;
import my.architrack.app.statement.StatementRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Exports every row that passes the current filter, in the current sort order. Pagination
 * never limits an export.
 */
@Service
@Transactional(readOnly = true)
public class StatementExportService {
	private static final Logger logger = LoggerFactory.getLogger(StatementExportService.class);

	private final ItemizedStatementService statementService;
	private final StatementQueryEngine queryEngine;
	private final SpreadsheetExporter spreadsheetExporter;
	private final ClipboardTextFormatter clipboardTextFormatter;
	private final Clock clock;

	public StatementExportService(ItemizedStatementService statementService,
								  StatementQueryEngine queryEngine,
								  SpreadsheetExporter spreadsheetExporter,
								  ClipboardTextFormatter clipboardTextFormatter,
								  Clock clock) {
		this.statementService = statementService;
		this.queryEngine = queryEngine;
		this.spreadsheetExporter = spreadsheetExporter;
		this.clipboardTextFormatter = clipboardTextFormatter;
		this.clock = clock;
	}

	public ExportedFile exportSpreadsheet(Long id, RowFilter filter, SortState sort) {
		ItemizedStatement statement = statementService.requireActive(id);
		List<StatementRow> rows = visibleRows(statement, filter, sort);
		try {
			ExportedFile file = spreadsheetExporter.export(statement.getName(), rows, LocalDate.now(clock));
			logger.debug("Exported itemized statement {} to {} ({} rows).", id, file.filename(), rows.size());
			return file;
		} catch (IOException | RuntimeException exc) {
			logger.warn("Spreadsheet export of itemized statement {} failed.", id, exc);
			throw new ExportFailedException("Failed to write spreadsheet for itemized statement " + id, exc);
		}
	}

	public String copyAsText(Long id, RowFilter filter, SortState sort) {
		ItemizedStatement statement = statementService.requireActive(id);
		List<StatementRow> rows = visibleRows(statement, filter, sort);
		try {
			String text = clipboardTextFormatter.format(rows);
			logger.debug("Copied itemized statement {} as text ({} rows).", id, rows.size());
			return text;
		} catch (RuntimeException exc) {
			logger.warn("Clipboard text for itemized statement {} failed.", id, exc);
			throw new CopyFailedException("Failed to format itemized statement " + id + " as text", exc);
		}
	}

	private List<StatementRow> visibleRows(ItemizedStatement statement, RowFilter filter, SortState sort) {
		return queryEngine.filterAndSort(statementService.loadRows(statement),
				filter == null ? RowFilter.NONE : filter,
				sort == null ? SortState.NONE : sort);
	}
}
