package my.architrack.app.export;

import my.architrack.app.statement.StatementColumn;
import my.architrack.app.statement.StatementRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Writes statement rows into an .xlsx workbook held entirely in memory.
 */
public class SpreadsheetExporter {
	public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
	public static final String EXTENSION = "xlsx";
	private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
	private static final Pattern UNSAFE_FILENAME = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

	public ExportedFile export(String statementName, List<StatementRow> rows, LocalDate exportDate) throws IOException {
		try (XSSFWorkbook workbook = new XSSFWorkbook();
			 ByteArrayOutputStream out = new ByteArrayOutputStream()) {
			Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(statementName));

			CellStyle headerStyle = workbook.createCellStyle();
			Font bold = workbook.createFont();
			bold.setBold(true);
			headerStyle.setFont(bold);

			CellStyle quantityStyle = workbook.createCellStyle();
			quantityStyle.setDataFormat(workbook.createDataFormat().getFormat("0.00"));

			StatementColumn[] columns = StatementColumn.values();
			Row header = sheet.createRow(0);
			for (int i = 0; i < columns.length; i++) {
				Cell cell = header.createCell(i);
				cell.setCellValue(columns[i].label());
				cell.setCellStyle(headerStyle);
			}

			int rowIndex = 1;
			for (StatementRow row : rows) {
				Row sheetRow = sheet.createRow(rowIndex++);
				for (int i = 0; i < columns.length; i++) {
					Cell cell = sheetRow.createCell(i);
					if (columns[i].isText()) {
						cell.setCellValue(columns[i].text(row));
					} else {
						cell.setCellValue(QuantityFormat.scaled(row.quantity()).doubleValue());
						cell.setCellStyle(quantityStyle);
					}
				}
			}

			workbook.write(out);
			return new ExportedFile(filename(statementName, exportDate), CONTENT_TYPE, out.toByteArray());
		}
	}

	public String filename(String statementName, LocalDate exportDate) {
		String base = UNSAFE_FILENAME.matcher(statementName).replaceAll("_");
		return base + "_" + FILE_DATE.format(exportDate) + "." + EXTENSION;
	}
}
