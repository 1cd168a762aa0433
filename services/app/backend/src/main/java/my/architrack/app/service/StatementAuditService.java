package my.architrack.app.service;

import my.architrack.app.domain.ItemizedStatementAudit;
import my.architrack.app.repository.ItemizedStatementAuditRepository;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

@Service
public class StatementAuditService {
	public static final String ACTION_CREATED = "ITEMIZED_STATEMENT_CREATED";
	public static final String ACTION_DELETED = "ITEMIZED_STATEMENT_DELETED";

	private final ItemizedStatementAuditRepository repository;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public StatementAuditService(ItemizedStatementAuditRepository repository, ObjectMapper objectMapper, Clock clock) {
		this.repository = repository;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public void record(String action, Long statementId, String actor, Map<String, Object> details) {
		ItemizedStatementAudit audit = new ItemizedStatementAudit();
		audit.setAction(action);
		audit.setItemizedStatementId(statementId);
		audit.setActor(actor == null || actor.isBlank() ? "system" : actor);
		audit.setOccurredAt(LocalDateTime.now(clock));
		audit.setDetails(details == null ? null : objectMapper.writeValueAsString(details));
		repository.save(audit);
	}
}
