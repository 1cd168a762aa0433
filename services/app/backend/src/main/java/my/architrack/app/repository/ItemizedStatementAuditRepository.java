package my.architrack.app.repository;

import my.architrack.app.domain.ItemizedStatementAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ItemizedStatementAuditRepository extends JpaRepository<ItemizedStatementAudit, Long> {
	List<ItemizedStatementAudit> findByItemizedStatementIdOrderByIdAsc(Long itemizedStatementId);
}
