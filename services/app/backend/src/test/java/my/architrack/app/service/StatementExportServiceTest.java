package my.architrack.app.service;

import my.architrack.app.domain.ItemizedStatement;
import my.architrack.app.export.ClipboardTextFormatter;
import my.architrack.app.export.ExportedFile;
import my.architrack.app.export.SpreadsheetExporter;
import my.architrack.app.statement.CopyFailedException;
import my.architrack.app.statement.ExportFailedException;
import my.architrack.app.statement.RowFilter;
import my.architrack.app.statement.SortDirection;
import my.architrack.app.statement.SortState;
import my.architrack.app.statement.StatementColumn;
import my.architrack.app.statement.StatementQueryEngine;
import my.architrack.app.statement.StatementRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatementExportServiceTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);

	@Mock
	private ItemizedStatementService statementService;

	@Mock
	private SpreadsheetExporter spreadsheetExporter;

	@Mock
	private ClipboardTextFormatter failingFormatter;

	private StatementExportService exportService;
	private ItemizedStatement statement;
	private List<StatementRow> rows;

	@BeforeEach
	void setUp() {
		exportService = new StatementExportService(statementService, new StatementQueryEngine(), spreadsheetExporter,
				new ClipboardTextFormatter(), CLOCK);
		statement = new ItemizedStatement();
		statement.setItemizedStatementId(5L);
		statement.setName("Tender");
		rows = new ArrayList<>();
		for (int i = 0; i < 120; i++) {
			rows.add(new StatementRow(i % 2 == 0 ? "Structure" : "Finishes", "W", "Item " + i, "", "m",
					new BigDecimal(i)));
		}
		when(statementService.requireActive(5L)).thenReturn(statement);
		when(statementService.loadRows(statement)).thenReturn(rows);
	}

	@Test
	void clipboardCoversEveryFilteredRowRegardlessOfPaging() {
		RowFilter filter = RowFilter.of(Map.of(StatementColumn.CUSTOM_CATEGORY, "struct"));
		SortState sort = SortState.by(StatementColumn.QUANTITY, SortDirection.DESC);

		String text = exportService.copyAsText(5L, filter, sort);

		String[] lines = text.split("\n");
		assertThat(lines).hasSize(61);
		assertThat(lines[1]).startsWith("Structure\tW\tItem 118\t");
		assertThat(lines[60]).startsWith("Structure\tW\tItem 0\t");
	}

	@Test
	void spreadsheetReceivesFilteredRowsAndClockDate() throws Exception {
		ExportedFile file = new ExportedFile("Tender_20250615.xlsx", SpreadsheetExporter.CONTENT_TYPE, new byte[]{1});
		when(spreadsheetExporter.export(eq("Tender"), anyList(), eq(LocalDate.of(2025, 6, 15)))).thenReturn(file);

		ExportedFile exported = exportService.exportSpreadsheet(5L,
				RowFilter.of(Map.of(StatementColumn.CUSTOM_CATEGORY, "fin")), SortState.NONE);

		assertThat(exported).isSameAs(file);
		@SuppressWarnings("unchecked")
		ArgumentCaptor<List<StatementRow>> captor = ArgumentCaptor.forClass(List.class);
		verify(spreadsheetExporter).export(eq("Tender"), captor.capture(), any(LocalDate.class));
		assertThat(captor.getValue()).hasSize(60).allMatch(row -> row.customCategory().equals("Finishes"));
	}

	@Test
	void writeFailureBecomesExportFailed() throws Exception {
		when(spreadsheetExporter.export(eq("Tender"), anyList(), any(LocalDate.class)))
				.thenThrow(new IOException("disk full"));

		assertThatThrownBy(() -> exportService.exportSpreadsheet(5L, RowFilter.NONE, SortState.NONE))
				.isInstanceOf(ExportFailedException.class)
				.hasCauseInstanceOf(IOException.class);
	}

	@Test
	void formatterFailureBecomesCopyFailed() {
		IllegalStateException failure = new IllegalStateException("formatter broke");
		when(failingFormatter.format(anyList())).thenThrow(failure);
		StatementExportService failingService = new StatementExportService(statementService, new StatementQueryEngine(),
				spreadsheetExporter, failingFormatter, CLOCK);

		assertThatThrownBy(() -> failingService.copyAsText(5L, RowFilter.NONE, SortState.NONE))
				.isInstanceOfSatisfying(CopyFailedException.class, ex -> {
					assertThat(ex.getCode()).isEqualTo("COPY_FAILED");
					assertThat(ex.getStatus().value()).isEqualTo(500);
				})
				.hasCause(failure);
	}
}
