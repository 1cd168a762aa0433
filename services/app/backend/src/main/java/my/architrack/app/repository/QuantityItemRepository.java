package my.architrack.app.repository;

import my.architrack.app.domain.QuantityItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface QuantityItemRepository extends JpaRepository<QuantityItem, Long> {
	@Query(value = "select qi.* "
			+ "from quantity_items qi "
			+ "join quantity_groups qg on qg.quantity_group_id = qi.quantity_group_id "
			+ "where qg.quantity_table_id = ?1 "
			+ "order by qg.display_order, qg.quantity_group_id, qi.display_order, qi.quantity_item_id",
			nativeQuery = true)
	List<QuantityItem> findByQuantityTableOrdered(Long quantityTableId);
}
