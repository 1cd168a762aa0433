package my.architrack.app.repository;

import my.architrack.app.domain.ItemizedStatementItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ItemizedStatementItemRepository extends JpaRepository<ItemizedStatementItem, Long> {
	List<ItemizedStatementItem> findByItemizedStatementIdOrderByDisplayOrderAsc(Long itemizedStatementId);
}
