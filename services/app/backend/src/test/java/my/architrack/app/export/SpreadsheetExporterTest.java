package my.architrack.app.export;

import my.architrack.app.statement.StatementRow;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpreadsheetExporterTest {
	private final SpreadsheetExporter exporter = new SpreadsheetExporter();

	@Test
	void writesHeaderAndOneRowPerStatementRow() throws Exception {
		List<StatementRow> rows = List.of(
				new StatementRow("Structure", "Concrete", "Slab", "C30", "m3", new BigDecimal("14.75")),
				new StatementRow("", "Steel", "Beam", "", "t", new BigDecimal("-2.50")));

		ExportedFile file = exporter.export("Tender A", rows, LocalDate.of(2024, 3, 9));

		assertThat(file.filename()).isEqualTo("Tender A_20240309.xlsx");
		assertThat(file.contentType()).isEqualTo(SpreadsheetExporter.CONTENT_TYPE);
		try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(file.content()))) {
			Sheet sheet = workbook.getSheetAt(0);
			assertThat(sheet.getSheetName()).isEqualTo("Tender A");
			assertThat(sheet.getLastRowNum()).isEqualTo(2);

			Row header = sheet.getRow(0);
			assertThat(header.getCell(0).getStringCellValue()).isEqualTo("Category");
			assertThat(header.getCell(4).getStringCellValue()).isEqualTo("Quantity");
			assertThat(header.getCell(5).getStringCellValue()).isEqualTo("Unit");

			Row first = sheet.getRow(1);
			assertThat(first.getCell(2).getStringCellValue()).isEqualTo("Slab");
			assertThat(first.getCell(4).getCellType()).isEqualTo(CellType.NUMERIC);
			assertThat(first.getCell(4).getNumericCellValue()).isEqualTo(14.75);
			assertThat(first.getCell(4).getCellStyle().getDataFormatString()).isEqualTo("0.00");

			Row second = sheet.getRow(2);
			assertThat(second.getCell(0).getStringCellValue()).isEmpty();
			assertThat(second.getCell(4).getNumericCellValue()).isEqualTo(-2.5);
		}
	}

	@Test
	void emptyRowListStillWritesHeader() throws Exception {
		ExportedFile file = exporter.export("Empty", List.of(), LocalDate.of(2024, 1, 1));

		try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(file.content()))) {
			assertThat(workbook.getSheetAt(0).getLastRowNum()).isZero();
		}
	}

	@Test
	void filenameReplacesUnsafeCharacters() {
		assertThat(exporter.filename("Phase 1/2: \"draft\"", LocalDate.of(2025, 12, 31)))
				.isEqualTo("Phase 1_2_ _draft__20251231.xlsx");
	}

	@Test
	void filenameKeepsNonAsciiNames() {
		assertThat(exporter.filename("内訳書", LocalDate.of(2025, 1, 2))).isEqualTo("内訳書_20250102.xlsx");
	}
}
