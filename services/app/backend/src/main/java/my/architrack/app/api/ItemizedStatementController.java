package my.architrack.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.architrack.app.config.AppProperties;
import my.architrack.app.dto.CreateItemizedStatementRequest;
import my.architrack.app.dto.DeleteItemizedStatementRequest;
import my.architrack.app.dto.ItemizedStatementCreatedDto;
import my.architrack.app.dto.ItemizedStatementDetailDto;
import my.architrack.app.dto.ItemizedStatementPageDto;
import my.architrack.app.dto.ItemizedStatementSummaryDto;
import my.architrack.app.dto.StatementRowPageDto;
import my.architrack.app.export.ExportFormat;
import my.architrack.app.export.ExportedFile;
import my.architrack.app.service.ItemizedStatementService;
import my.architrack.app.service.StatementExportService;
import my.architrack.app.service.StatementQueryParser;
import my.architrack.app.statement.RowFilter;
import my.architrack.app.statement.SortState;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Itemized Statements")
public class ItemizedStatementController {
	private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

	private final ItemizedStatementService statementService;
	private final StatementExportService exportService;
	private final StatementQueryParser queryParser;
	private final AppProperties properties;

	public ItemizedStatementController(ItemizedStatementService statementService,
									   StatementExportService exportService,
									   StatementQueryParser queryParser,
									   AppProperties properties) {
		this.statementService = statementService;
		this.exportService = exportService;
		this.queryParser = queryParser;
		this.properties = properties;
	}

	@PostMapping("/projects/{projectId}/itemized-statements")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Create itemized statement from a quantity table")
	public ItemizedStatementCreatedDto create(@PathVariable Long projectId,
											  @Valid @RequestBody CreateItemizedStatementRequest request,
											  Principal principal) {
		String createdBy = principal == null ? "system" : principal.getName();
		return statementService.create(projectId, request.name(), request.quantityTableId(), createdBy);
	}

	@GetMapping("/projects/{projectId}/itemized-statements")
	@Operation(summary = "List itemized statements of a project")
	public ItemizedStatementPageDto list(@PathVariable Long projectId,
										 @RequestParam(required = false) Integer page,
										 @RequestParam(required = false) Integer limit,
										 @RequestParam(required = false) String sort,
										 @RequestParam(required = false) String order,
										 @RequestParam(required = false) String search) {
		return statementService.list(projectId, page, limit, sort, order, search);
	}

	@GetMapping("/projects/{projectId}/itemized-statements/latest")
	@Operation(summary = "Count and newest itemized statements of a project")
	public ItemizedStatementSummaryDto latest(@PathVariable Long projectId,
											  @RequestParam(required = false) Integer limit) {
		return statementService.latestSummary(projectId, limit);
	}

	@GetMapping("/itemized-statements/{id}")
	@Operation(summary = "Get itemized statement header")
	public ItemizedStatementDetailDto get(@PathVariable Long id) {
		return statementService.findDetail(id);
	}

	@GetMapping("/itemized-statements/{id}/items")
	@Operation(summary = "Filter, sort and page itemized statement rows")
	public StatementRowPageDto items(@PathVariable Long id,
									 @RequestParam(required = false) Integer page,
									 @RequestParam Map<String, String> params) {
		return statementService.queryRows(id, queryParser.parse(params, page, properties.statements().rowPageSize()));
	}

	@GetMapping("/itemized-statements/{id}/export")
	@Operation(summary = "Export filtered and sorted rows as spreadsheet or clipboard text")
	public ResponseEntity<byte[]> export(@PathVariable Long id,
										 @RequestParam(required = false) String format,
										 @RequestParam Map<String, String> params) {
		ExportFormat exportFormat = queryParser.parseFormat(format == null ? ExportFormat.SPREADSHEET.key() : format);
		RowFilter filter = queryParser.parseFilter(params);
		SortState sort = queryParser.parseSort(params);
		if (exportFormat == ExportFormat.CLIPBOARD) {
			String text = exportService.copyAsText(id, filter, sort);
			return ResponseEntity.ok()
					.contentType(TEXT_PLAIN_UTF8)
					.body(text.getBytes(StandardCharsets.UTF_8));
		}
		ExportedFile file = exportService.exportSpreadsheet(id, filter, sort);
		ContentDisposition disposition = ContentDisposition.attachment()
				.filename(file.filename(), StandardCharsets.UTF_8)
				.build();
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
				.contentType(MediaType.parseMediaType(file.contentType()))
				.body(file.content());
	}

	@DeleteMapping("/itemized-statements/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	@Operation(summary = "Delete itemized statement if the version token is current")
	public void delete(@PathVariable Long id,
					   @Valid @RequestBody DeleteItemizedStatementRequest request,
					   Principal principal) {
		String actor = principal == null ? "system" : principal.getName();
		statementService.delete(id, request.version(), actor);
	}
}
