package my.architrack.app.service;

import my.architrack.app.config.AppProperties;
import my.architrack.app.domain.ItemizedStatement;
import my.architrack.app.domain.ItemizedStatementItem;
import my.architrack.app.domain.Project;
import my.architrack.app.dto.ItemizedStatementCreatedDto;
import my.architrack.app.dto.ItemizedStatementDetailDto;
import my.architrack.app.dto.ItemizedStatementDto;
import my.architrack.app.dto.ItemizedStatementPageDto;
import my.architrack.app.dto.ItemizedStatementSummaryDto;
import my.architrack.app.dto.ProjectSummaryDto;
import my.architrack.app.dto.StatementRowDto;
import my.architrack.app.dto.StatementRowPageDto;
import my.architrack.app.repository.ItemizedStatementItemRepository;
import my.architrack.app.repository.ItemizedStatementRepository;
import my.architrack.app.statement.DuplicateStatementNameException;
import my.architrack.app.statement.EmptyQuantityItemsException;
import my.architrack.app.statement.QuantityAggregator;
import my.architrack.app.statement.QuantityItemView;
import my.architrack.app.statement.QuantityTableNotFoundException;
import my.architrack.app.statement.RowPage;
import my.architrack.app.statement.StatementColumn;
import my.architrack.app.statement.StatementNotFoundException;
import my.architrack.app.statement.StatementQuery;
import my.architrack.app.statement.StatementQueryEngine;
import my.architrack.app.statement.StatementRow;
import my.architrack.app.statement.StatementValidationException;
import my.architrack.app.statement.StatementVersionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class ItemizedStatementService {
	private static final Logger logger = LoggerFactory.getLogger(ItemizedStatementService.class);
	static final int MAX_NAME_LENGTH = 200;
	static final int MAX_LIST_LIMIT = 100;
	static final int MAX_LATEST_LIMIT = 50;

	private final ItemizedStatementRepository statementRepository;
	private final ItemizedStatementItemRepository itemRepository;
	private final QuantityTableReader quantityTableReader;
	private final ProjectContextService projectContextService;
	private final StatementAuditService auditService;
	private final QuantityAggregator aggregator;
	private final StatementQueryEngine queryEngine;
	private final StatementVersionGuard versionGuard;
	private final AppProperties.Statements settings;
	private final Clock clock;

	public ItemizedStatementService(ItemizedStatementRepository statementRepository,
									ItemizedStatementItemRepository itemRepository,
									QuantityTableReader quantityTableReader,
									ProjectContextService projectContextService,
									StatementAuditService auditService,
									QuantityAggregator aggregator,
									StatementQueryEngine queryEngine,
									StatementVersionGuard versionGuard,
									AppProperties properties,
									Clock clock) {
		this.statementRepository = statementRepository;
		this.itemRepository = itemRepository;
		this.quantityTableReader = quantityTableReader;
		this.projectContextService = projectContextService;
		this.auditService = auditService;
		this.aggregator = aggregator;
		this.queryEngine = queryEngine;
		this.versionGuard = versionGuard;
		this.settings = properties.statements();
		this.clock = clock;
	}

	/**
	 * Aggregates the quantity table into a new statement. Nothing is written unless every
	 * check passes, and the rows never change afterwards.
	 */
	@Transactional
	public ItemizedStatementCreatedDto create(Long projectId, String rawName, Long quantityTableId, String actor) {
		projectContextService.requireProject(projectId);
		String name = normalizeName(rawName);

		QuantityTableReader.QuantityTableSource table = quantityTableReader.findTable(quantityTableId)
				.filter(source -> projectId.equals(source.projectId()))
				.orElseThrow(() -> new QuantityTableNotFoundException(quantityTableId));

		List<QuantityItemView> items = quantityTableReader.readItems(table.id());
		if (items.isEmpty()) {
			throw new EmptyQuantityItemsException(table.id());
		}
		QuantityAggregator.AggregationResult aggregation = aggregator.aggregate(items);
		if (aggregation.isEmpty()) {
			throw new EmptyQuantityItemsException(table.id());
		}
		if (aggregation.rows().size() > settings.maxRows()) {
			throw new StatementValidationException("Statement would contain " + aggregation.rows().size()
					+ " rows; at most " + settings.maxRows() + " are allowed");
		}
		if (statementRepository.existsByProjectIdAndNameAndDeletedAtIsNull(projectId, name)) {
			throw new DuplicateStatementNameException(name, projectId);
		}

		LocalDateTime now = LocalDateTime.now(clock);
		ItemizedStatement statement = new ItemizedStatement();
		statement.setProjectId(projectId);
		statement.setName(name);
		statement.setActiveName(name);
		statement.setSourceQuantityTableId(table.id());
		statement.setSourceQuantityTableName(table.name());
		statement.setItemCount(aggregation.rows().size());
		statement.setCreatedBy(actor);
		statement.setCreatedAt(now);
		statement.setUpdatedAt(now);
		ItemizedStatement saved;
		try {
			saved = statementRepository.saveAndFlush(statement);
		} catch (DataIntegrityViolationException exc) {
			// a concurrent create committed the same name after the check above
			logger.warn("Itemized statement name '{}' in project {} was taken concurrently.", name, projectId);
			throw new DuplicateStatementNameException(name, projectId, exc);
		}

		List<ItemizedStatementItem> rows = new ArrayList<>(aggregation.rows().size());
		int order = 0;
		for (StatementRow row : aggregation.rows()) {
			rows.add(toEntity(saved.getItemizedStatementId(), row, order++));
		}
		itemRepository.saveAll(rows);

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("name", name);
		details.put("projectId", projectId);
		details.put("quantityTableId", table.id());
		details.put("quantityTableName", table.name());
		details.put("itemCount", aggregation.rows().size());
		details.put("sourceItemCount", aggregation.sourceItemCount());
		auditService.record(StatementAuditService.ACTION_CREATED, saved.getItemizedStatementId(), actor, details);

		logger.info("Created itemized statement {} '{}' in project {} from quantity table {} ({} rows from {} items).",
				saved.getItemizedStatementId(), name, projectId, table.id(),
				aggregation.rows().size(), aggregation.sourceItemCount());

		StatementQuery firstPage = new StatementQuery(null, null, 1, settings.rowPageSize());
		return new ItemizedStatementCreatedDto(toDto(saved), toRowPageDto(queryEngine.query(aggregation.rows(), firstPage), firstPage));
	}

	@Transactional(readOnly = true)
	public ItemizedStatementDetailDto findDetail(Long id) {
		ItemizedStatement statement = requireActive(id);
		Project project = projectContextService.requireProject(statement.getProjectId());
		return new ItemizedStatementDetailDto(toDto(statement), new ProjectSummaryDto(project.getProjectId(), project.getName()));
	}

	@Transactional(readOnly = true)
	public ItemizedStatementPageDto list(Long projectId, Integer page, Integer limit, String sort, String order, String search) {
		projectContextService.requireProject(projectId);
		int resolvedPage = page == null ? 1 : page;
		int resolvedLimit = limit == null ? settings.listPageSize() : limit;
		if (resolvedPage < 1) {
			throw new StatementValidationException("page must be >= 1");
		}
		if (resolvedLimit < 1 || resolvedLimit > MAX_LIST_LIMIT) {
			throw new StatementValidationException("limit must be between 1 and " + MAX_LIST_LIMIT);
		}
		PageRequest pageable = PageRequest.of(resolvedPage - 1, resolvedLimit, listSort(sort, order));
		Page<ItemizedStatement> result;
		if (search == null || search.isBlank()) {
			result = statementRepository.findByProjectIdAndDeletedAtIsNull(projectId, pageable);
		} else {
			String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
			result = statementRepository.searchActive(projectId, pattern, pageable);
		}
		List<ItemizedStatementDto> data = result.getContent().stream().map(this::toDto).toList();
		return new ItemizedStatementPageDto(data, resolvedPage, resolvedLimit, result.getTotalElements(), result.getTotalPages());
	}

	@Transactional(readOnly = true)
	public ItemizedStatementSummaryDto latestSummary(Long projectId, Integer limit) {
		projectContextService.requireProject(projectId);
		int resolvedLimit = limit == null ? settings.latestLimit() : limit;
		if (resolvedLimit < 1 || resolvedLimit > MAX_LATEST_LIMIT) {
			throw new StatementValidationException("limit must be between 1 and " + MAX_LATEST_LIMIT);
		}
		long total = statementRepository.countByProjectIdAndDeletedAtIsNull(projectId);
		List<ItemizedStatementDto> latest = statementRepository
				.findByProjectIdAndDeletedAtIsNullOrderByCreatedAtDescItemizedStatementIdDesc(projectId, PageRequest.of(0, resolvedLimit))
				.stream()
				.map(this::toDto)
				.toList();
		return new ItemizedStatementSummaryDto(total, latest);
	}

	@Transactional(readOnly = true)
	public StatementRowPageDto queryRows(Long id, StatementQuery query) {
		List<StatementRow> rows = loadRows(requireActive(id));
		RowPage page = queryEngine.query(rows, query);
		logger.debug("Queried itemized statement {} with {}: {} of {} rows on page {}.",
				id, query, page.rows().size(), page.totalCount(), page.currentPage());
		return toRowPageDto(page, query);
	}

	@Transactional
	public void delete(Long id, long expectedVersion, String actor) {
		ItemizedStatement statement = requireActive(id);
		versionGuard.verify(expectedVersion, statement.getVersion());
		LocalDateTime now = LocalDateTime.now(clock);
		versionGuard.guardedWrite(expectedVersion, version -> statementRepository.markDeleted(id, version, now));

		Map<String, Object> details = new LinkedHashMap<>();
		details.put("name", statement.getName());
		details.put("projectId", statement.getProjectId());
		details.put("version", expectedVersion);
		auditService.record(StatementAuditService.ACTION_DELETED, id, actor, details);

		logger.info("Deleted itemized statement {} '{}' (version {}).", id, statement.getName(), expectedVersion);
	}

	public ItemizedStatement requireActive(Long id) {
		return statementRepository.findByItemizedStatementIdAndDeletedAtIsNull(id)
				.orElseThrow(() -> new StatementNotFoundException(id));
	}

	public List<StatementRow> loadRows(ItemizedStatement statement) {
		return itemRepository.findByItemizedStatementIdOrderByDisplayOrderAsc(statement.getItemizedStatementId()).stream()
				.map(item -> new StatementRow(item.getCustomCategory(), item.getWorkType(), item.getName(),
						item.getSpecification(), item.getUnit(), item.getQuantity()))
				.toList();
	}

	private String normalizeName(String rawName) {
		String name = rawName == null ? "" : rawName.trim();
		if (name.isEmpty()) {
			throw new StatementValidationException("name is required");
		}
		if (name.length() > MAX_NAME_LENGTH) {
			throw new StatementValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
		}
		return name;
	}

	private Sort listSort(String sort, String order) {
		Sort.Direction direction;
		if (order == null || order.isBlank()) {
			direction = Sort.Direction.DESC;
		} else {
			direction = switch (order.trim().toLowerCase(Locale.ROOT)) {
				case "asc" -> Sort.Direction.ASC;
				case "desc" -> Sort.Direction.DESC;
				default -> throw new StatementValidationException("Unknown sort order: " + order);
			};
		}
		String property;
		if (sort == null || sort.isBlank()) {
			property = "createdAt";
		} else {
			property = switch (sort.trim()) {
				case "createdAt" -> "createdAt";
				case "name" -> "name";
				default -> throw new StatementValidationException("Unknown sort field: " + sort);
			};
		}
		return Sort.by(direction, property).and(Sort.by(direction, "itemizedStatementId"));
	}

	private ItemizedStatementItem toEntity(Long statementId, StatementRow row, int order) {
		ItemizedStatementItem item = new ItemizedStatementItem();
		item.setItemizedStatementId(statementId);
		item.setCustomCategory(row.customCategory());
		item.setWorkType(row.workType());
		item.setName(row.name());
		item.setSpecification(row.specification());
		item.setUnit(row.unit());
		item.setQuantity(row.quantity());
		item.setDisplayOrder(order);
		return item;
	}

	private ItemizedStatementDto toDto(ItemizedStatement statement) {
		return new ItemizedStatementDto(
				statement.getItemizedStatementId(),
				statement.getProjectId(),
				statement.getName(),
				statement.getSourceQuantityTableId(),
				statement.getSourceQuantityTableName(),
				statement.getItemCount(),
				statement.getCreatedBy(),
				statement.getCreatedAt(),
				statement.getUpdatedAt(),
				statement.getVersion()
		);
	}

	private StatementRowPageDto toRowPageDto(RowPage page, StatementQuery query) {
		List<StatementRowDto> items = page.rows().stream()
				.map(row -> new StatementRowDto(row.customCategory(), row.workType(), row.name(),
						row.specification(), row.unit(), row.quantity()))
				.toList();
		Map<String, String> filters = new LinkedHashMap<>();
		for (Map.Entry<StatementColumn, String> entry : query.filter().values().entrySet()) {
			filters.put(entry.getKey().key(), entry.getValue());
		}
		String sortColumn = query.sort().isActive() ? query.sort().column().key() : null;
		String sortDirection = query.sort().isActive() ? query.sort().direction().key() : null;
		return new StatementRowPageDto(items, page.totalCount(), page.totalPages(), page.currentPage(),
				page.pageSize(), sortColumn, sortDirection, filters);
	}
}
